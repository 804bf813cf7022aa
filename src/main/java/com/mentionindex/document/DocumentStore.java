package com.mentionindex.document;

import java.io.IOException;
import java.util.List;

/**
 * 宿主文档存储的边界。
 *
 * <p>文档以稳定的字符串 ID 标识；读取失败以 {@link IOException} 抛出，由调用方决定是否跳过。
 */
public interface DocumentStore {

    /**
     * 列出语料中的全部文本文档 ID。
     */
    List<String> listDocuments();

    boolean exists(String documentId);

    String read(String documentId) throws IOException;

    DocumentMetadata metadata(String documentId) throws IOException;

    void write(String documentId, String content) throws IOException;
}
