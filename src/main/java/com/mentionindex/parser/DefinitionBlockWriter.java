package com.mentionindex.parser;

import com.mentionindex.config.DividerConfig;
import com.mentionindex.model.LineRange;
import com.mentionindex.model.PersonRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 把人员记录写回合并型定义文档：按行范围原地替换，或追加到文末。
 */
public class DefinitionBlockWriter {

    private final DividerConfig dividers;

    public DefinitionBlockWriter(DividerConfig dividers) {
        this.dividers = dividers;
    }

    /**
     * 生成一个完整定义块的行，以分隔行结尾。
     */
    public List<String> render(PersonRecord record) {
        List<String> lines = renderBody(record);
        lines.add(dividers.preferredDivider());
        return lines;
    }

    /**
     * 用新生成的块替换 {@code range} 覆盖的行。
     *
     * <p>范围之后紧跟分隔行时不再重复写入分隔行。
     */
    public String replaceRecord(String content, PersonRecord record, LineRange range) {
        List<String> lines = splitLines(content);
        if (range.to() >= lines.size()) {
            throw new IllegalArgumentException("行范围超出文档: " + range + ", 文档行数=" + lines.size());
        }

        List<String> before = lines.subList(0, range.from());
        List<String> after = lines.subList(range.to() + 1, lines.size());
        boolean followedByDivider = !after.isEmpty() && dividers.isDivider(after.get(0));
        List<String> block = followedByDivider ? renderBody(record) : render(record);

        List<String> result = new ArrayList<>(lines.size() - range.lineCount() + block.size());
        result.addAll(before);
        result.addAll(block);
        result.addAll(after);
        return String.join("\n", result);
    }

    /**
     * 在文末追加记录；文档未以分隔行结尾时先补一条。
     */
    public String appendRecord(String content, PersonRecord record) {
        List<String> lines = splitLines(content == null ? "" : content);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        if (!lines.isEmpty() && !dividers.isDivider(lines.get(lines.size() - 1))) {
            lines.add("");
            lines.add(dividers.preferredDivider());
        }
        lines.addAll(render(record));
        return String.join("\n", lines);
    }

    /**
     * 单人文档的正文，不含分隔行。
     */
    public String renderAtomic(PersonRecord record) {
        List<String> lines = renderBody(record);
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines) + "\n";
    }

    private List<String> renderBody(PersonRecord record) {
        List<String> lines = new ArrayList<>();
        lines.add(DefinitionBlockParser.NAME_PREFIX + record.fullName());
        if (!record.position().isEmpty()) {
            lines.add(DefinitionBlockParser.POSITION_PREFIX + record.position());
        }
        if (!record.department().isEmpty()) {
            lines.add(DefinitionBlockParser.DEPARTMENT_PREFIX + record.department());
        }
        lines.add("");
        lines.add(record.notes().stripTrailing());
        lines.add("");
        return lines;
    }

    private static List<String> splitLines(String content) {
        return new ArrayList<>(Arrays.asList(DefinitionBlockParser.splitLines(content)));
    }
}
