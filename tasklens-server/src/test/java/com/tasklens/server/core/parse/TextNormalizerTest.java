package com.tasklens.server.core.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextNormalizerTest {

    @Test
    void collapsesWhitespaceRuns() {
        assertEquals("fix the bug", TextNormalizer.collapse("  fix \n\t the   bug "));
        assertEquals("a b", TextNormalizer.collapse("a  b"));
        assertEquals("", TextNormalizer.collapse(null));
    }

    @Test
    void rejectsShortTextAndBareSlashCommands() {
        assertFalse(TextNormalizer.looksActionable("abc"));
        assertFalse(TextNormalizer.looksActionable("   "));
        assertFalse(TextNormalizer.looksActionable("/clear"));
        assertFalse(TextNormalizer.looksActionable("  /Review-PR_2 "));
    }

    @Test
    void acceptsRealTasks() {
        assertTrue(TextNormalizer.looksActionable("fix it"));
        assertTrue(TextNormalizer.looksActionable("/review the payments module"));
    }
}
