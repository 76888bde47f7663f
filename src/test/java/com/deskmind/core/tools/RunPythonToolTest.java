package com.deskmind.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RunPythonToolTest {

    private static boolean pythonAvailable() {
        String path = System.getenv("PATH");
        return path != null && Arrays.stream(path.split(File.pathSeparator))
                .anyMatch(dir -> Files.isExecutable(Path.of(dir, "python3")));
    }

    @Test
    @DisplayName("missing code argument is rejected")
    void missingCode() {
        var tool = new RunPythonTool("python3", Duration.ofSeconds(5));

        assertThrows(IllegalArgumentException.class, () -> tool.invoke(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> tool.invoke(Map.of("code", "  ")));
    }

    @Test
    @DisplayName("an interpreter that cannot be started raises IOException")
    void missingInterpreter() {
        var tool = new RunPythonTool("/nonexistent/deskmind-python", Duration.ofSeconds(5));

        assertThrows(IOException.class, () -> tool.invoke(Map.of("code", "print(1)")));
    }

    @Test
    @DisplayName("returns what the script prints")
    void returnsOutput() throws Exception {
        assumeTrue(pythonAvailable(), "python3 not on PATH");
        var tool = new RunPythonTool("python3", Duration.ofSeconds(20));

        assertEquals("42", tool.invoke(Map.of("code", "print(6 * 7)")));
        assertEquals("(no output)", tool.invoke(Map.of("code", "x = 1")));
    }

    @Test
    @DisplayName("reports a non-zero exit code with stderr")
    void reportsExitCode() throws Exception {
        assumeTrue(pythonAvailable(), "python3 not on PATH");
        var tool = new RunPythonTool("python3", Duration.ofSeconds(20));

        String output = tool.invoke(Map.of("code", "import sys\nsys.stderr.write('bad input')\nsys.exit(3)"));

        assertEquals("Exit code 3: bad input", output);
    }

    @Test
    @DisplayName("kills scripts that outlive the timeout")
    void timesOut() throws Exception {
        assumeTrue(pythonAvailable(), "python3 not on PATH");
        var tool = new RunPythonTool("python3", Duration.ofSeconds(1));

        assertEquals("Timed out after 1s", tool.invoke(Map.of("code", "import time\ntime.sleep(30)")));
    }

    @Test
    @DisplayName("an interrupted invocation kills the script and rethrows")
    void interruptKillsScript() throws Exception {
        assumeTrue(pythonAvailable(), "python3 not on PATH");
        var tool = new RunPythonTool("python3", Duration.ofSeconds(20));
        var failure = new AtomicReference<Exception>();
        var runner = new Thread(() -> {
            try {
                tool.invoke(Map.of("code", "import time\ntime.sleep(30)"));
            } catch (Exception e) {
                failure.set(e);
            }
        });

        runner.start();
        Thread.sleep(1_000);
        runner.interrupt();
        runner.join(5_000);

        assertFalse(runner.isAlive());
        assertInstanceOf(InterruptedException.class, failure.get());
    }
}
