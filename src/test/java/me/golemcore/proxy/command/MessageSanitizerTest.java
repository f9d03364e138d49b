package me.golemcore.proxy.command;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageSanitizerTest {

    private final MessageSanitizer sanitizer = new MessageSanitizer();

    @Test
    void shouldRemoveProxySpans() {
        String message = "Hello there.\n\u200B<proxy>\nThinking enabled.\n\u200B</proxy>";

        assertEquals("Hello there.\n", sanitizer.strip(message));
    }

    @Test
    void shouldRemoveSpansWithoutZeroWidthSpace() {
        assertEquals("A B", sanitizer.strip("A <proxy>x</proxy>B"));
    }

    @Test
    void shouldCollapseSpacesAndTrimLines() {
        assertEquals("one two\nthree", sanitizer.strip("\n\n  one   two  \n three \n"));
    }

    @Test
    void shouldKeepListIndentation() {
        String message = "Items:\n  - first   item\n    * nested  item";

        assertEquals("Items:\n  - first item\n    * nested item", sanitizer.strip(message));
    }

    @Test
    void shouldNotTreatInlineDashAsList() {
        assertEquals("a - b", sanitizer.strip("  a  -  b"));
    }

    @Test
    void shouldReturnEmptyForNullOrEmpty() {
        assertEquals("", sanitizer.strip(null));
        assertEquals("", sanitizer.strip(""));
    }
}
