package com.whereq.iris.engine;

import com.whereq.iris.config.IrisProperties;
import com.whereq.iris.exception.EngineUnavailableException;
import com.whereq.iris.exception.MacroExecutionException;
import com.whereq.iris.model.MacroInvocation;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs macros through a headless Fiji launcher, one external process per invocation.
 *
 * <p>Invocations are serialized by a fair lock. Each invocation returns its own stdout as the
 * macro output and its own stderr as the engine log; nothing is kept between invocations.
 *
 * @author WhereQ Inc.
 */
@Component
@Slf4j
public class FijiProcessEngine implements MacroEngine {

    static final String READINESS_MACRO = "print(\"iris-engine-ready\");\n";

    private static final List<String> LAUNCHER_NAMES = List.of(
            "ImageJ-linux64", "ImageJ-macosx", "ImageJ-win64.exe", "fiji", "ImageJ");

    private final IrisProperties.EngineConfig config;
    private final ReentrantLock invocationLock = new ReentrantLock(true);
    private final AtomicBoolean disposed = new AtomicBoolean();

    private volatile String executable;
    private volatile Process running;

    public FijiProcessEngine(IrisProperties properties) {
        this.config = properties.getEngine();
    }

    @Override
    @PostConstruct
    public void initialize() {
        int retries = Math.max(1, config.getInitRetries());
        for (int attempt = 1; attempt <= retries; attempt++) {
            try {
                log.info("Initializing Fiji engine (attempt {}/{})", attempt, retries);
                long startTime = System.currentTimeMillis();

                String candidate = resolveExecutable();
                execute(candidate, READINESS_MACRO);

                this.executable = candidate;
                log.info("Fiji engine initialized in {}ms using {}",
                        System.currentTimeMillis() - startTime, candidate);
                return;
            } catch (Exception e) {
                log.error("Failed to initialize Fiji engine (attempt {}/{}): {}",
                        attempt, retries, e.getMessage(), e);
                if (attempt < retries) {
                    log.info("Retrying Fiji engine initialization in {}", config.getInitRetryDelay());
                    if (!sleep(config.getInitRetryDelay().toMillis())) {
                        break;
                    }
                }
            }
        }
        log.error("Exceeded maximum retries for Fiji engine initialization, engine unavailable");
    }

    @Override
    public MacroInvocation runMacro(String script) {
        invocationLock.lock();
        try {
            if (!isReady()) {
                throw new EngineUnavailableException("Fiji engine has not been initialized");
            }
            return execute(executable, script);
        } finally {
            invocationLock.unlock();
        }
    }

    @Override
    public boolean isReady() {
        return executable != null && !disposed.get();
    }

    @Override
    public String getExecutable() {
        return executable;
    }

    @Override
    @PreDestroy
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        Process process = running;
        if (process != null && process.isAlive()) {
            log.warn("Killing running macro process on shutdown");
            process.destroyForcibly();
        }
        executable = null;
        log.info("Fiji engine disposed");
    }

    private MacroInvocation execute(String launcher, String script) {
        Path scriptFile = null;
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            scriptFile = Files.createTempFile("iris-macro-", ".ijm");
            stdoutFile = Files.createTempFile("iris-macro-", ".out");
            stderrFile = Files.createTempFile("iris-macro-", ".err");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(launcher);
            command.addAll(config.getHeadlessArgs());
            command.add("-macro");
            command.add(scriptFile.toAbsolutePath().toString());
            log.debug("Executing command: {}", String.join(" ", command));

            ProcessBuilder processBuilder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            Process process = processBuilder.start();
            running = process;

            long timeoutMs = config.getInvocationTimeout().toMillis();
            boolean completed = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            String engineLog = Files.readString(stderrFile, StandardCharsets.UTF_8);
            if (!completed) {
                process.destroyForcibly();
                throw new MacroExecutionException(
                        "Macro execution timed out after " + config.getInvocationTimeout());
            }

            String output = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            log.debug("Macro output:\n{}", output);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new MacroExecutionException(
                        "Macro failed with exit code: " + exitCode + "\n" + engineLog);
            }
            return MacroInvocation.of(output, engineLog);
        } catch (IOException e) {
            throw new MacroExecutionException("Failed to run macro: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MacroExecutionException("Interrupted while waiting for macro", e);
        } finally {
            running = null;
            deleteQuietly(scriptFile);
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /**
     * Find the Fiji launcher: configured path, then FIJI_HOME, then PATH.
     */
    private String resolveExecutable() {
        if (config.getExecutable() != null && !config.getExecutable().isBlank()) {
            return config.getExecutable();
        }

        String fijiHome = System.getenv("FIJI_HOME");
        if (fijiHome != null && !fijiHome.isEmpty()) {
            for (String name : LAUNCHER_NAMES) {
                File launcher = new File(fijiHome, name);
                if (launcher.exists() && launcher.canExecute()) {
                    return launcher.getAbsolutePath();
                }
            }
        }

        String path = System.getenv("PATH");
        if (path != null) {
            for (String dir : path.split(File.pathSeparator)) {
                for (String name : LAUNCHER_NAMES) {
                    File launcher = new File(dir, name);
                    if (launcher.exists() && launcher.canExecute()) {
                        return launcher.getAbsolutePath();
                    }
                }
            }
        }

        log.warn("Could not find a Fiji launcher in FIJI_HOME or PATH, using '{}'", LAUNCHER_NAMES.get(0));
        return LAUNCHER_NAMES.get(0);
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary macro file {}", path, e);
        }
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
