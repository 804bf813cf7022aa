package com.mentionindex.parser;

/**
 * 解析时由所在文档提供、被每条记录继承的属性。
 */
public record SourceContext(
        String documentId,
        String companyName,
        String companyLogo,
        String companyColor,
        String companyUrl
) {

    public static SourceContext of(String documentId) {
        return new SourceContext(documentId, baseName(documentId), "", "", "");
    }

    /**
     * 去掉目录与扩展名后的文件名。
     */
    public static String baseName(String documentId) {
        if (documentId == null || documentId.isEmpty()) {
            return "";
        }
        String fileName = documentId;
        int slashIndex = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (slashIndex >= 0) {
            fileName = fileName.substring(slashIndex + 1);
        }
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }
}
