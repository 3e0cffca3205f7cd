package com.whereq.iris.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Iris.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "iris")
@Data
public class IrisProperties {

    private WorkspaceConfig workspace = new WorkspaceConfig();

    private EngineConfig engine = new EngineConfig();

    private PreviewConfig preview = new PreviewConfig();

    private LlmConfig llm = new LlmConfig();

    @Data
    public static class WorkspaceConfig {
        /**
         * Base directory for per-batch working directories.
         * Empty means the JVM temp directory.
         */
        private String root = "";

        /**
         * How long a working directory survives after its batch finished.
         */
        private Duration cleanupDelay = Duration.ofMinutes(5);

        /**
         * Subdirectories the macro template writes categorized results into.
         */
        private List<String> outputSubdirectories = new ArrayList<>(List.of("Images", "Statistics", "Metadata"));

        private String archiveName = "results.zip";
    }

    @Data
    public static class EngineConfig {
        /**
         * Fiji/ImageJ launcher. Blank means resolve from FIJI_HOME, then PATH.
         */
        private String executable = "";

        private List<String> headlessArgs = new ArrayList<>(List.of("--headless", "--console"));

        private Duration invocationTimeout = Duration.ofMinutes(10);

        private int initRetries = 3;

        private Duration initRetryDelay = Duration.ofSeconds(5);

        private String macroTemplate = "classpath:macros/macro_template.ijm";

        private String previewTemplate = "classpath:macros/preview_template.ijm";

        /**
         * Log line tag the macro prints in front of every file it saved.
         */
        private String outputMarker = "OUTPUT_FILE:";
    }

    @Data
    public static class PreviewConfig {
        private Duration logTimeout = Duration.ofSeconds(60);

        private Duration fileTimeout = Duration.ofSeconds(120);

        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Number of size polls before an existing but still changing file is given up on.
         */
        private int stabilityRounds = 10;
    }

    @Data
    public static class LlmConfig {
        private String baseUrl = "https://api.anthropic.com";

        private String apiKey = "";

        private String model = "claude-3-5-sonnet-20241022";

        private int maxTokens = 4096;

        private double temperature = 0.2;

        private String apiVersion = "2023-06-01";

        private Duration readTimeout = Duration.ofMinutes(5);
    }
}
