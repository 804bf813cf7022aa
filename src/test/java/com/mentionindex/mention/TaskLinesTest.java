package com.mentionindex.mention;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mentionindex.model.MentionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TaskLinesTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "- [ ] John Smith will review the draft",
        "* [x] done",
        "+ [X] done",
        "1. [ ] numbered",
        "12. [x] numbered",
        "   - [ ] indented",
        "-[ ] no space"
    })
    void testTaskLines(String line) {
        assertTrue(TaskLines.isTask(line));
        assertEquals(MentionType.TASK, TaskLines.classify(line));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "- [] empty box",
        "- item",
        "text [ ] later",
        "[ ] bare box",
        "1) [ ] paren",
        "- [y] other mark"
    })
    void testTextLines(String line) {
        assertFalse(TaskLines.isTask(line));
        assertEquals(MentionType.TEXT, TaskLines.classify(line));
    }

    @Test
    void testNullIsNotTask() {
        assertFalse(TaskLines.isTask(null));
    }
}
