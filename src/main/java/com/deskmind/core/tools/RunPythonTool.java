package com.deskmind.core.tools;

import com.deskmind.core.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Executes Python source with a local interpreter.
 * <p>
 * The source comes from the {@code code} argument. Output is captured through
 * temporary files so a chatty script cannot block on a full pipe; the process is
 * killed when it outlives {@code deskmind.engine.tool-timeout}.
 */
@Component
public class RunPythonTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(RunPythonTool.class);

    static final String NAME = "run_python";

    private final String interpreter;
    private final Duration timeout;

    @Autowired
    public RunPythonTool(@Value("${deskmind.tools.python-interpreter:python3}") String interpreter,
                         EngineProperties properties) {
        this(interpreter, properties.getToolTimeout());
    }

    RunPythonTool(String interpreter, Duration timeout) {
        this.interpreter = interpreter;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Run Python 3 source code passed in the 'code' argument and return what it prints";
    }

    @Override
    public String invoke(Map<String, Object> args) throws IOException, InterruptedException {
        Object code = args.get("code");
        if (code == null || code.toString().isBlank()) {
            throw new IllegalArgumentException("Missing 'code' argument");
        }

        Path script = Files.createTempFile("deskmind-", ".py");
        Path stdout = Files.createTempFile("deskmind-", ".out");
        Path stderr = Files.createTempFile("deskmind-", ".err");
        try {
            Files.writeString(script, code.toString(), StandardCharsets.UTF_8);
            Process process = new ProcessBuilder(List.of(interpreter, script.toString()))
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            boolean exited;
            try {
                exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                log.warn("Python script killed: invocation cancelled");
                throw e;
            }
            if (!exited) {
                process.destroyForcibly();
                log.warn("Python script killed after {}s", timeout.toSeconds());
                return "Timed out after " + timeout.toSeconds() + "s";
            }

            String out = Files.readString(stdout, StandardCharsets.UTF_8).strip();
            String err = Files.readString(stderr, StandardCharsets.UTF_8).strip();
            int exitCode = process.exitValue();
            log.debug("Python script exited with {}", exitCode);
            if (exitCode != 0) {
                return "Exit code " + exitCode + (err.isEmpty() ? "" : ": " + err);
            }
            if (out.isEmpty()) {
                return err.isEmpty() ? "(no output)" : err;
            }
            return out;
        } finally {
            Files.deleteIfExists(script);
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }
}
