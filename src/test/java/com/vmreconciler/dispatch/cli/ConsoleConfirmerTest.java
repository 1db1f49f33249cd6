package com.vmreconciler.dispatch.cli;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleConfirmerTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private ConsoleConfirmer confirmer(String input, boolean assumeYes) {
        return new ConsoleConfirmer(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true), assumeYes);
    }

    @Test
    void acceptsYesAnswers() {
        var confirmer = confirmer("y\n YES \n", false);

        assertTrue(confirmer.confirm("Delete BLOB?"));
        assertTrue(confirmer.confirm("Delete BLOB?"));
        assertTrue(out.toString().contains("Delete BLOB? [y/N]"));
    }

    @Test
    void anythingElseDeclines() {
        var confirmer = confirmer("n\nsure\n", false);

        assertFalse(confirmer.confirm("q1"));
        assertFalse(confirmer.confirm("q2"));
        assertFalse(confirmer.confirm("q3"), "end of input declines");
    }

    @Test
    void assumedYesDoesNotPrompt() {
        var confirmer = confirmer("", false);
        confirmer.assumeYes();

        assertTrue(confirmer.confirm("Destroy web-1?"));
        assertEquals("", out.toString());
    }
}
