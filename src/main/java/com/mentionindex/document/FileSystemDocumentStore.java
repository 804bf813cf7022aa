package com.mentionindex.document;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * 以目录为语料的文档存储，文档 ID 为相对根目录、以 {@code /} 分隔的路径。
 */
public class FileSystemDocumentStore implements DocumentStore {

    private static final String MARKDOWN_EXTENSION = ".md";

    private final Path root;

    public FileSystemDocumentStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public List<String> listDocuments() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(MARKDOWN_EXTENSION))
                .map(this::toDocumentId)
                .sorted()
                .toList();
        } catch (IOException ioException) {
            throw new UncheckedIOException("遍历语料目录失败: " + root, ioException);
        }
    }

    @Override
    public boolean exists(String documentId) {
        return Files.isRegularFile(resolve(documentId));
    }

    @Override
    public String read(String documentId) throws IOException {
        return Files.readString(resolve(documentId), StandardCharsets.UTF_8);
    }

    @Override
    public DocumentMetadata metadata(String documentId) throws IOException {
        return FrontmatterReader.read(read(documentId));
    }

    @Override
    public void write(String documentId, String content) throws IOException {
        Path target = resolve(documentId);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
    }

    private Path resolve(String documentId) {
        Path resolved = root.resolve(documentId).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("文档 ID 超出语料根目录: " + documentId);
        }
        return resolved;
    }

    private String toDocumentId(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
