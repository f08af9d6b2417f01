package com.example.offshore.allocation.cli;

@FunctionalInterface
public interface ConfirmationPrompt {

    /**
     * Shows {@code message} and reports whether the operator agreed.
     */
    boolean confirm(String message);
}
