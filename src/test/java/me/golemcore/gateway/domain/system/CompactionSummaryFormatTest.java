package me.golemcore.gateway.domain.system;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CompactionSummaryFormatTest {

    @Test
    void shouldListAllSectionsInInstructions() {
        String instructions = CompactionSummaryFormat.instructions();

        for (String section : CompactionSummaryFormat.SECTIONS) {
            assertTrue(instructions.contains(section), section);
        }
        assertTrue(instructions.indexOf("Primary Request and Intent") < instructions.indexOf("Optional Next Step"));
    }

    @Test
    void shouldRecognizeHeadingVariants() {
        assertEquals("Pending Tasks", CompactionSummaryFormat.sectionOf("## 7. Pending Tasks"));
        assertEquals("Pending Tasks", CompactionSummaryFormat.sectionOf("7. Pending Tasks:"));
        assertEquals("Pending Tasks", CompactionSummaryFormat.sectionOf("**Pending Tasks**"));
        assertEquals("Current Work", CompactionSummaryFormat.sectionOf("### current work"));
        assertNull(CompactionSummaryFormat.sectionOf("- fix the pending tasks list"));
        assertNull(CompactionSummaryFormat.sectionOf("## Random Heading"));
    }

    @Test
    void shouldReorderAndFillMissingSections() {
        String raw = """
                Here is the summary.
                **Current Work**
                Editing Lexer.java

                1. Primary Request and Intent:
                Port the lexer.
                """;

        String normalized = CompactionSummaryFormat.normalize(raw).orElseThrow();

        assertTrue(normalized.startsWith("## 1. Primary Request and Intent\nPort the lexer.\n\n"
                + "## 2. Key Technical Concepts\nNone."));
        assertTrue(normalized.contains("## 8. Current Work\nEditing Lexer.java"));
        assertFalse(normalized.contains("Here is the summary."));
        assertEquals(9, normalized.split("\n## ").length);
    }

    @Test
    void shouldRejectAnswerWithoutSections() {
        assertEquals(Optional.empty(), CompactionSummaryFormat.normalize("I summarized it for you."));
        assertEquals(Optional.empty(), CompactionSummaryFormat.normalize(null));
    }
}
