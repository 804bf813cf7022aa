package com.mentionindex.parser;

import com.mentionindex.document.DocumentMetadata;
import com.mentionindex.document.FrontmatterReader;

import java.util.Arrays;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 文档前导部分：frontmatter 与可选的首行 logo 图片链接。
 *
 * @param bodyStartLine 正文首行在原文档中的行号
 */
public record DocumentPreamble(
        Map<String, Object> frontmatter,
        String logoLine,
        String body,
        int bodyStartLine
) {

    private static final Pattern IMAGE_LINK = Pattern.compile("!\\[.*]\\(.*\\)");

    public static DocumentPreamble of(String content) {
        String safeContent = content == null ? "" : content;
        DocumentMetadata metadata = FrontmatterReader.read(safeContent);
        String body = FrontmatterReader.body(safeContent, metadata);
        int bodyStartLine = metadata.frontmatterLineCount();

        String[] lines = DefinitionBlockParser.splitLines(body);
        for (int index = 0; index < lines.length; index++) {
            String trimmed = lines[index].trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (IMAGE_LINK.matcher(trimmed).find()) {
                String remaining = String.join("\n", Arrays.copyOfRange(lines, index + 1, lines.length));
                return new DocumentPreamble(metadata.frontmatter(), trimmed, remaining, bodyStartLine + index + 1);
            }
            break;
        }
        return new DocumentPreamble(metadata.frontmatter(), "", body, bodyStartLine);
    }

    public String companyColor() {
        Object color = frontmatter.get("color");
        return color instanceof String text ? CompanyColors.parse(text) : "";
    }

    public String companyUrl() {
        Object url = frontmatter.get("url");
        return url instanceof String text ? text : "";
    }
}
