package com.mentionindex.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mentionindex.config.EngineConfig;
import com.mentionindex.model.FileKind;
import com.mentionindex.model.LineRange;
import com.mentionindex.model.PersonRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefinitionDocumentParserTest {

    private final DefinitionDocumentParser parser = new DefinitionDocumentParser(EngineConfig.defaults());

    @Test
    @DisplayName("frontmatter 与 logo 行不影响原文档行号")
    void testLineRangesAreAbsolute() {
        String content = String.join("\n",
            "---",
            "color: blue",
            "url: https://acme.example",
            "---",
            "![logo](acme.png)",
            "",
            "# John Smith",
            "Position: Engineer",
            "",
            "Notes",
            "---",
            "");

        List<PersonRecord> records = parser.parseDocument("Acme.md", content);

        assertEquals(1, records.size());
        PersonRecord john = records.get(0);
        assertEquals(new LineRange(6, 9), john.sourceLineRange());
        assertEquals("# John Smith", content.split("\n")[john.sourceLineRange().from()]);
        assertEquals("Acme", john.companyName());
        assertEquals("![logo](acme.png)", john.companyLogo());
        assertEquals("#0066cc", john.companyColor());
        assertEquals("https://acme.example", john.companyUrl());
    }

    @Test
    void testAtomicMarker() {
        String content = "---\ndef-type: atomic\n---\n# Jane Doe\nPosition: CTO\n\nBio\n";

        List<PersonRecord> records = parser.parseDocument("people/Jane Doe.md", content);

        assertEquals(1, records.size());
        assertEquals(FileKind.ATOMIC, records.get(0).fileKind());
        assertEquals("Bio", records.get(0).notes());
    }

    @Test
    void testLegacyMarkerIsCaseInsensitive() {
        String content = "---\nmetadata-type: Consolidated\n---\n# A\n---\n# B\n";

        List<PersonRecord> records = parser.parseDocument("Globex.md", content);

        assertEquals(2, records.size());
        assertEquals(new LineRange(3, 3), records.get(0).sourceLineRange());
        assertEquals(new LineRange(5, 6), records.get(1).sourceLineRange());
    }

    @Test
    void testDefaultKindWhenUnmarked() {
        EngineConfig config = EngineConfig.defaults();
        config.setDefaultFileKind(FileKind.ATOMIC);
        DefinitionDocumentParser atomicByDefault = new DefinitionDocumentParser(config);

        assertEquals(2, parser.parseDocument("x.md", DefinitionBlockParserTest.TWO_BLOCKS).size());
        assertEquals(1, atomicByDefault.parseDocument("x.md", DefinitionBlockParserTest.TWO_BLOCKS).size());
    }

    @Test
    void testEmptyDocument() {
        assertTrue(parser.parseDocument("x.md", "").isEmpty());
        assertTrue(parser.parseDocument("x.md", "---\ndef-type: consolidated\n---\n").isEmpty());
    }
}
