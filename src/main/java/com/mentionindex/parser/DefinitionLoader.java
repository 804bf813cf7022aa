package com.mentionindex.parser;

import com.mentionindex.document.DefinitionMarker;
import com.mentionindex.document.DocumentStore;
import com.mentionindex.model.PersonRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 从文档存储批量加载人员记录。读取失败的文档记录警告后跳过。
 */
public class DefinitionLoader {
    private static final Logger logger = LoggerFactory.getLogger(DefinitionLoader.class);

    private final DocumentStore store;
    private final DefinitionParser parser;

    public DefinitionLoader(DocumentStore store, DefinitionParser parser) {
        this.store = store;
        this.parser = parser;
    }

    /**
     * 只加载带定义类型标记的文档。
     */
    public List<PersonRecord> loadMarkedDocuments() {
        return load(true);
    }

    /**
     * 把存储中的每个文档都当作定义文档加载。
     */
    public List<PersonRecord> loadAllDocuments() {
        return load(false);
    }

    private List<PersonRecord> load(boolean markedOnly) {
        List<PersonRecord> records = new ArrayList<>();
        int documents = 0;
        for (String documentId : store.listDocuments()) {
            try {
                if (markedOnly && !DefinitionMarker.isDefinitionDocument(store.metadata(documentId))) {
                    continue;
                }
                records.addAll(parser.parseDocument(documentId, store.read(documentId)));
                documents++;
            } catch (IOException e) {
                logger.warn("读取定义文档失败，跳过: {} ({})", documentId, e.getMessage());
            }
        }
        logger.info("从 {} 个定义文档加载 {} 条人员记录", documents, records.size());
        return records;
    }
}
