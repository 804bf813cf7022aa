package com.mentionindex.parser;

import com.mentionindex.model.PersonRecord;

import java.util.List;

/**
 * 定义文档解析端口，上层（提及计数、导入导出）只依赖此接口。
 */
public interface DefinitionParser {

    /**
     * 解析一篇完整文档（含 frontmatter）为人员记录。
     */
    List<PersonRecord> parseDocument(String documentId, String content);
}
