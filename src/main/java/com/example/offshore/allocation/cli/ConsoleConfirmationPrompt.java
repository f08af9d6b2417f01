package com.example.offshore.allocation.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Reads a yes/no answer from standard input. Only "yes" and "y" count as agreement; end of input is a no.
 */
@Component
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsoleConfirmationPrompt() {
        this(System.in, System.out);
    }

    ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public boolean confirm(String message) {
        out.print(message + " (yes/no): ");
        out.flush();
        try {
            String answer = reader.readLine();
            return isAffirmative(answer);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read confirmation from console", ex);
        }
    }

    static boolean isAffirmative(String answer) {
        if (answer == null) {
            return false;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("yes") || normalized.equals("y");
    }
}
