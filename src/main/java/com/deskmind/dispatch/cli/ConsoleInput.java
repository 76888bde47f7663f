package com.deskmind.dispatch.cli;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The one reader over standard input, shared by the shell loop and the console
 * human channel so neither buffers lines away from the other.
 */
@Component
public class ConsoleInput {

    private final BufferedReader reader;

    public ConsoleInput() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    ConsoleInput(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * @return the next line without its terminator, or null at end of input
     */
    public synchronized String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from standard input", e);
        }
    }
}
