package com.apisite.checker.cli;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleConfirmationPromptTest {

    @Test
    void onlyExplicitYesConfirms() {
        assertThat(answer("y\n")).isTrue();
        assertThat(answer("  YES \n")).isTrue();
        assertThat(answer("n\n")).isFalse();
        assertThat(answer("\n")).isFalse();
        assertThat(answer("yeah\n")).isFalse();
        assertThat(answer("")).isFalse();
    }

    @Test
    void assumeYesSkipsReadingInput() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleConfirmationPrompt prompt = new ConsoleConfirmationPrompt(
            new BufferedReader(new StringReader("n\n")),
            new PrintStream(buffer, true, StandardCharsets.UTF_8),
            true
        );

        assertThat(prompt.confirm("Remove?")).isTrue();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("Remove? (y/N): y");
    }

    private boolean answer(String typed) {
        ConsoleConfirmationPrompt prompt = new ConsoleConfirmationPrompt(
            new BufferedReader(new StringReader(typed)),
            new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            false
        );
        return prompt.confirm("Remove?");
    }
}
