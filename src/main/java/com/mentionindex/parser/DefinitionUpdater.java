package com.mentionindex.parser;

import com.mentionindex.document.DocumentMetadata;
import com.mentionindex.document.DocumentStore;
import com.mentionindex.document.FrontmatterReader;
import com.mentionindex.model.FileKind;
import com.mentionindex.model.PersonRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * 记录修改与新增的写回流程。
 */
public class DefinitionUpdater {
    private static final Logger logger = LoggerFactory.getLogger(DefinitionUpdater.class);

    private final DocumentStore store;
    private final DefinitionDocumentParser parser;
    private final DefinitionBlockWriter writer;

    public DefinitionUpdater(DocumentStore store, DefinitionDocumentParser parser, DefinitionBlockWriter writer) {
        this.store = store;
        this.parser = parser;
        this.writer = writer;
    }

    /**
     * 以规范化姓名定位源文档中的记录并替换。
     *
     * @return 找到并写回时为 true
     */
    public boolean updateRecord(PersonRecord updated) throws IOException {
        String documentId = updated.sourceFileId();
        String content = store.read(documentId);

        if (parser.resolveKind(DocumentPreamble.of(content)) == FileKind.ATOMIC) {
            DocumentMetadata metadata = FrontmatterReader.read(content);
            String body = FrontmatterReader.body(content, metadata);
            String header = content.substring(0, content.length() - body.length());
            store.write(documentId, header + writer.renderAtomic(updated));
            return true;
        }

        Optional<PersonRecord> existing = parser.parseDocument(documentId, content).stream()
                .filter(record -> record.canonicalName().equals(updated.canonicalName()))
                .findFirst();
        if (existing.isEmpty() || existing.get().sourceLineRange() == null) {
            logger.warn("未在文档中找到记录，无法更新: {} in {}", updated.fullName(), documentId);
            return false;
        }

        store.write(documentId, writer.replaceRecord(content, updated, existing.get().sourceLineRange()));
        return true;
    }

    /**
     * 把记录追加到合并型定义文档，文档不存在时新建。
     */
    public void addRecord(String documentId, PersonRecord record) throws IOException {
        String content = store.exists(documentId) ? store.read(documentId) : "";
        store.write(documentId, writer.appendRecord(content, record));
        logger.info("已追加记录 {} 到 {}", record.fullName(), documentId);
    }
}
