package io.contextlink.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleCommandParserTest {
    @Test
    void parseTokensShouldSplitByWhitespace() {
        assertEquals(List.of("snippet", "src/A.java", "3", "9"), ConsoleCommandParser.parseTokens("  snippet   src/A.java 3  9 "));
        assertTrue(ConsoleCommandParser.parseTokens("   ").isEmpty());
    }

    @Test
    void parseShouldLowercaseTheOperation() {
        ConsoleCommandParser.ConsoleCommand command = ConsoleCommandParser.parse("STATUS");
        assertEquals("status", command.op());
        assertTrue(command.args().isEmpty());
    }

    @Test
    void snippetShouldAcceptFileWithOptionalRange() {
        ConsoleCommandParser.SnippetRequest whole = ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet a.txt"));
        assertEquals("a.txt", whole.file());
        assertNull(whole.startLine());

        ConsoleCommandParser.SnippetRequest range = ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet a.txt 2 4"));
        assertEquals(2, range.startLine());
        assertEquals(4, range.endLine());
    }

    @Test
    void snippetShouldRejectHalfRangesAndBadNumbers() {
        assertThrows(IllegalArgumentException.class, () -> ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet a.txt 2")));
        assertThrows(IllegalArgumentException.class, () -> ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet a.txt x 4")));
        assertThrows(IllegalArgumentException.class, () -> ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet a.txt 0 4")));
        assertThrows(IllegalArgumentException.class, () -> ConsoleCommandParser.snippet(ConsoleCommandParser.parse("snippet")));
    }

    @Test
    void isQuitShouldRecognizeExitWords() {
        assertTrue(ConsoleCommandParser.isQuit("quit"));
        assertTrue(ConsoleCommandParser.isQuit("exit"));
        assertFalse(ConsoleCommandParser.isQuit("status"));
    }
}
