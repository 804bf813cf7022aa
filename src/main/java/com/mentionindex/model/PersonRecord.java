package com.mentionindex.model;

import com.mentionindex.text.NameNormalizer;

/**
 * 一个定义块对应的人员记录。
 *
 * <p>{@code sourceLineRange} 仅对合并型文档有值；公司相关字段继承自所在文档。
 */
public record PersonRecord(
        String fullName,
        String position,
        String department,
        String notes,
        String sourceFileId,
        String linkText,
        FileKind fileKind,
        LineRange sourceLineRange,
        String companyName,
        String companyLogo,
        String companyColor,
        String companyUrl
) {

    public PersonRecord {
        if (fullName == null || fullName.isBlank()) {
            throw new IllegalArgumentException("fullName 不能为空");
        }
        position = nullToEmpty(position);
        department = nullToEmpty(department);
        notes = nullToEmpty(notes);
        sourceFileId = nullToEmpty(sourceFileId);
        linkText = nullToEmpty(linkText);
        companyName = nullToEmpty(companyName);
        companyLogo = nullToEmpty(companyLogo);
        companyColor = nullToEmpty(companyColor);
        companyUrl = nullToEmpty(companyUrl);
    }

    /**
     * 规范化姓名，作为索引与提及计数的统一身份。
     */
    public String canonicalName() {
        return NameNormalizer.normalize(fullName);
    }

    public PersonRecord withNotes(String newNotes) {
        return new PersonRecord(fullName, position, department, newNotes, sourceFileId, linkText, fileKind,
                sourceLineRange, companyName, companyLogo, companyColor, companyUrl);
    }

    public PersonRecord withSourceLineRange(LineRange range) {
        return new PersonRecord(fullName, position, department, notes, sourceFileId, linkText, fileKind,
                range, companyName, companyLogo, companyColor, companyUrl);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
