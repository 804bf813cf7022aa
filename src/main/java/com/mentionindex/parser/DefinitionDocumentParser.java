package com.mentionindex.parser;

import com.mentionindex.config.EngineConfig;
import com.mentionindex.document.DefinitionMarker;
import com.mentionindex.model.FileKind;
import com.mentionindex.model.PersonRecord;

import java.util.List;

/**
 * 按 frontmatter 类型标记选择块解析或单人解析，并把记录行号换算为原文档行号。
 */
public class DefinitionDocumentParser implements DefinitionParser {

    private final DefinitionBlockParser blockParser;
    private final AtomicDefinitionParser atomicParser;
    private final FileKind defaultKind;

    public DefinitionDocumentParser(EngineConfig config) {
        this.blockParser = new DefinitionBlockParser(config.getDividerConfig());
        this.atomicParser = new AtomicDefinitionParser();
        this.defaultKind = config.getDefaultFileKind();
    }

    @Override
    public List<PersonRecord> parseDocument(String documentId, String content) {
        DocumentPreamble preamble = DocumentPreamble.of(content);
        SourceContext context = new SourceContext(
                documentId,
                SourceContext.baseName(documentId),
                preamble.logoLine(),
                preamble.companyColor(),
                preamble.companyUrl()
        );

        FileKind kind = resolveKind(preamble);
        if (kind == FileKind.ATOMIC) {
            return atomicParser.parse(preamble.body(), context);
        }

        int offset = preamble.bodyStartLine();
        List<PersonRecord> records = blockParser.parse(preamble.body(), context);
        if (offset == 0) {
            return records;
        }
        return records.stream()
                .map(record -> record.withSourceLineRange(record.sourceLineRange().shift(offset)))
                .toList();
    }

    public FileKind resolveKind(DocumentPreamble preamble) {
        return DefinitionMarker.kindOf(preamble.frontmatter()).orElse(defaultKind);
    }
}
