package com.apisite.checker.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Set;

public class ConsoleConfirmationPrompt implements ConfirmationPrompt {
    private static final Logger log = LoggerFactory.getLogger(ConsoleConfirmationPrompt.class);
    private static final Set<String> AFFIRMATIVE = Set.of("y", "yes");

    private final BufferedReader input;
    private final PrintStream out;
    private final boolean assumeYes;

    public ConsoleConfirmationPrompt(BufferedReader input, PrintStream out, boolean assumeYes) {
        this.input = input;
        this.out = out;
        this.assumeYes = assumeYes;
    }

    @Override
    public boolean confirm(String question) {
        out.print(question + " (y/N): ");
        if (assumeYes) {
            out.println("y");
            return true;
        }
        out.flush();
        String answer;
        try {
            answer = input.readLine();
        } catch (IOException e) {
            log.warn("Could not read confirmation answer, treating as no", e);
            return false;
        }
        return isAffirmative(answer);
    }

    static boolean isAffirmative(String answer) {
        return answer != null && AFFIRMATIVE.contains(answer.trim().toLowerCase(Locale.ROOT));
    }
}
