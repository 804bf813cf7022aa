package com.mentionindex.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 读取文档开头以 {@code ---} 包围的 YAML frontmatter。
 */
public final class FrontmatterReader {
    private static final Logger logger = LoggerFactory.getLogger(FrontmatterReader.class);

    private static final String DELIMITER = "---";
    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private FrontmatterReader() {
    }

    /**
     * 解析 frontmatter。YAML 非法时 frontmatter 视为空表，但分隔区域仍然被识别。
     */
    public static DocumentMetadata read(String content) {
        if (content == null || content.isEmpty()) {
            return DocumentMetadata.EMPTY;
        }

        int firstLineEnd = lineEnd(content, 0);
        if (!DELIMITER.equals(content.substring(0, firstLineEnd).strip())) {
            return DocumentMetadata.EMPTY;
        }

        int lineStart = nextLineStart(content, firstLineEnd);
        int lineCount = 1;
        while (lineStart >= 0) {
            int currentEnd = lineEnd(content, lineStart);
            lineCount++;
            if (DELIMITER.equals(content.substring(lineStart, currentEnd).strip())) {
                String yaml = content.substring(nextLineStart(content, firstLineEnd), lineStart);
                return new DocumentMetadata(parseYaml(yaml), currentEnd, lineCount);
            }
            lineStart = nextLineStart(content, currentEnd);
        }
        return DocumentMetadata.EMPTY;
    }

    /**
     * 返回去掉 frontmatter 后的正文。
     */
    public static String body(String content, DocumentMetadata metadata) {
        if (!metadata.hasFrontmatter()) {
            return content;
        }
        int bodyStart = metadata.frontmatterEndOffset();
        if (bodyStart < content.length() && content.charAt(bodyStart) == '\r') {
            bodyStart++;
        }
        if (bodyStart < content.length() && content.charAt(bodyStart) == '\n') {
            bodyStart++;
        }
        return bodyStart >= content.length() ? "" : content.substring(bodyStart);
    }

    private static Map<String, Object> parseYaml(String yaml) {
        if (yaml.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> values = YAML_MAPPER.readValue(yaml, MAP_TYPE);
            return values == null ? Map.of() : values;
        } catch (JsonProcessingException exception) {
            logger.warn("frontmatter 解析失败，按空处理: {}", exception.getOriginalMessage());
            return Map.of();
        }
    }

    private static int lineEnd(String content, int from) {
        int newline = content.indexOf('\n', from);
        int end = newline < 0 ? content.length() : newline;
        if (end > from && content.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    private static int nextLineStart(String content, int lineEnd) {
        int newline = content.indexOf('\n', lineEnd);
        return newline < 0 ? -1 : newline + 1;
    }
}
