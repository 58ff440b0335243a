package org.learningjava.uniagent.domain.service.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextLinesTest {

    @Test
    void splitKeepEnds_handlesAllTerminators() {
        assertEquals(List.of("a\n", "b\r\n", "c\r", "d"), TextLines.splitKeepEnds("a\nb\r\nc\rd"));
        assertTrue(TextLines.splitKeepEnds("").isEmpty());
    }

    @Test
    void split_dropsTerminators() {
        assertEquals(List.of("a", "", "b"), TextLines.split("a\n\nb\n"));
    }

    @Test
    void stripCodeFences_removesOpeningAndClosingFence() {
        assertEquals("<p>x</p>", TextLines.stripCodeFences("```html\n<p>x</p>\n```"));
        assertEquals("", TextLines.stripCodeFences(null));
    }

    @Test
    void withLinePrefixes_numbersFromOne() {
        assertEquals("ln1, a\nln2, \nln3, c", TextLines.withLinePrefixes("a\n\nc\n", "ln"));
    }
}
