package com.scratchparser.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliOptionsTest {

    @Test
    void defaults() {
        CliOptions options = CliOptions.parse(new String[0]);
        assertNotNull(options);
        assertFalse(options.hasInput());
        assertFalse(options.compact());
        assertFalse(options.tokens());
        assertFalse(options.help());
    }

    @Test
    void filesKeepArgumentOrder() {
        CliOptions options = CliOptions.parse(new String[]{"b.scr", "--compact", "a.scr"});
        assertEquals(List.of(Path.of("b.scr"), Path.of("a.scr")), options.files());
        assertTrue(options.compact());
        assertTrue(options.hasInput());
    }

    @Test
    void inlineCode() {
        CliOptions options = CliOptions.parse(new String[]{"-c", "x;", "--tokens"});
        assertEquals("x;", options.code());
        assertTrue(options.tokens());
    }

    @Test
    void emptyInlineCodeCountsAsAbsent() {
        CliOptions options = CliOptions.parse(new String[]{"-c", ""});
        assertNull(options.code());
        assertFalse(options.hasInput());

        options = CliOptions.parse(new String[]{"-c", "", "a.scr"});
        assertNull(options.code());
        assertEquals(List.of(Path.of("a.scr")), options.files());
    }

    @Test
    void rejectsBadArguments() {
        assertNull(CliOptions.parse(new String[]{"-c"}));
        assertNull(CliOptions.parse(new String[]{"-x"}));
        assertNull(CliOptions.parse(new String[]{"-c", "x;", "file.scr"}));
        assertNull(CliOptions.parse(new String[]{"-c", "a;", "-c", "b;"}));
    }
}
