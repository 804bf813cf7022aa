package com.mentionindex.document;

import com.mentionindex.config.Constants;
import com.mentionindex.model.FileKind;

import java.util.Map;
import java.util.Optional;

/**
 * 根据 frontmatter 类型标记识别定义文档。
 */
public final class DefinitionMarker {

    private DefinitionMarker() {
    }

    public static Optional<FileKind> kindOf(Map<String, Object> frontmatter) {
        if (frontmatter == null || frontmatter.isEmpty()) {
            return Optional.empty();
        }
        Optional<FileKind> kind = FileKind.fromMarker(frontmatter.get(Constants.DEF_TYPE_KEY));
        if (kind.isPresent()) {
            return kind;
        }
        return FileKind.fromMarker(frontmatter.get(Constants.LEGACY_DEF_TYPE_KEY));
    }

    public static boolean isDefinitionDocument(DocumentMetadata metadata) {
        return kindOf(metadata.frontmatter()).isPresent();
    }
}
