package com.mentionindex.parser;

import com.mentionindex.model.FileKind;
import com.mentionindex.model.PersonRecord;

import java.util.List;

/**
 * 单人定义文档解析器：整篇正文只产生一条记录。
 */
public class AtomicDefinitionParser {

    public List<PersonRecord> parse(String body, SourceContext context) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }

        String fullName = "";
        String position = "";
        String department = "";
        StringBuilder notes = new StringBuilder();
        for (String line : DefinitionBlockParser.splitLines(body)) {
            if (line.startsWith(DefinitionBlockParser.NAME_PREFIX)) {
                fullName = line.substring(DefinitionBlockParser.NAME_PREFIX.length()).strip();
            } else if (line.startsWith(DefinitionBlockParser.POSITION_PREFIX)) {
                position = line.substring(DefinitionBlockParser.POSITION_PREFIX.length()).strip();
            } else if (line.startsWith(DefinitionBlockParser.DEPARTMENT_PREFIX)) {
                department = line.substring(DefinitionBlockParser.DEPARTMENT_PREFIX.length()).strip();
            } else {
                notes.append(line).append('\n');
            }
        }

        if (fullName.isBlank()) {
            return List.of();
        }
        return List.of(new PersonRecord(
                fullName,
                position,
                department,
                notes.toString().strip(),
                context.documentId(),
                context.documentId(),
                FileKind.ATOMIC,
                null,
                context.companyName(),
                context.companyLogo(),
                context.companyColor(),
                context.companyUrl()
        ));
    }
}
