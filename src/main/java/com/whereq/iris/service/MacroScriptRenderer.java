package com.whereq.iris.service;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.model.Job;
import com.whereq.iris.model.JobParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns macro templates into complete, directly runnable macros.
 *
 * @author WhereQ Inc.
 */
@Component
@Slf4j
public class MacroScriptRenderer {

    static final String USER_MACRO_PLACEHOLDER = "{user_macro}";

    private final ResourceLoader resourceLoader;
    private final IrisProperties.EngineConfig engineConfig;
    private final List<String> outputSubdirectories;
    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public MacroScriptRenderer(ResourceLoader resourceLoader, IrisProperties properties) {
        this.resourceLoader = resourceLoader;
        this.engineConfig = properties.getEngine();
        this.outputSubdirectories = properties.getWorkspace().getOutputSubdirectories();
    }

    /**
     * Batch macro for one job: variable bindings for the job followed by the macro template
     * with the user script in place of {@value #USER_MACRO_PLACEHOLDER}. A blank user script
     * leaves only the template's own processing.
     */
    public String render(Job job, String userMacro) {
        String template = template(engineConfig.getMacroTemplate());
        String script = bindings(job) + template.replace(USER_MACRO_PLACEHOLDER, userMacro == null ? "" : userMacro);
        log.debug("Full macro script:\n{}", script);
        return script;
    }

    /**
     * Preview macro that converts one image and reports its preview and metadata paths
     * into {@code outputLogPath}.
     */
    public String renderPreview(Path inputPath, Path outputDir, String filename, Path outputLogPath) {
        return template(engineConfig.getPreviewTemplate())
                .replace("{input_path}", macroPath(inputPath))
                .replace("{output_dir}", macroPath(outputDir))
                .replace("{filename}", escape(filename))
                .replace("{output_log_path}", macroPath(outputLogPath));
    }

    String bindings(Job job) {
        JobParameters params = job.getParameters();
        String outputDir = macroPath(job.getWorkingDir()) + "/";

        StringBuilder vars = new StringBuilder();
        vars.append("var inputPath = \"").append(macroPath(job.getInputPath())).append("\";\n");
        vars.append("var outputDir = \"").append(outputDir).append("\";\n");
        vars.append("var originalFileName = \"").append(escape(job.getNameStem())).append("\";\n");
        vars.append("var minSize = ").append(number(params.getMinSize())).append(";\n");
        vars.append("var maxSize = \"").append(escape(params.getMaxSize())).append("\";\n");
        vars.append("var minCircularity = ").append(number(params.getMinCircularity())).append(";\n");
        vars.append("var maxCircularity = ").append(number(params.getMaxCircularity())).append(";\n");
        for (String subdir : outputSubdirectories) {
            vars.append("var ").append(variableName(subdir)).append(" = \"")
                    .append(outputDir).append(escape(subdir)).append("/\";\n");
        }
        return vars.append('\n').toString();
    }

    private String template(String location) {
        return templates.computeIfAbsent(location, this::load);
    }

    private String load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new UncheckedIOException(new FileNotFoundException("Macro template does not exist at: " + location));
        }
        try (InputStream in = resource.getInputStream()) {
            log.info("Loaded macro template {}", location);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read macro template " + location, e);
        }
    }

    /**
     * "Images" becomes "imagesDir".
     */
    static String variableName(String subdir) {
        String clean = subdir.replaceAll("[^A-Za-z0-9]", "");
        return clean.substring(0, 1).toLowerCase(Locale.ROOT) + clean.substring(1) + "Dir";
    }

    private static String macroPath(Path path) {
        return escape(path.toAbsolutePath().toString().replace('\\', '/'));
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
