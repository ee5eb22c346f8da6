package com.apisite.checker.cli;

@FunctionalInterface
public interface ConfirmationPrompt {
    /**
     * Asks a yes/no question. Anything other than an explicit yes is a no.
     */
    boolean confirm(String question);
}
