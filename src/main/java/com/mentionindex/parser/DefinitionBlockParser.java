package com.mentionindex.parser;

import com.mentionindex.config.DividerConfig;
import com.mentionindex.model.FileKind;
import com.mentionindex.model.LineRange;
import com.mentionindex.model.PersonRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 合并型定义文档的块解析器。
 *
 * <p>输入为已去除 frontmatter 与 logo 行的正文，输出记录的行号相对于该正文。
 * 状态迁移由纯函数 {@link #step} 完成，解析器本身不持有可变状态。
 */
public class DefinitionBlockParser {

    static final String NAME_PREFIX = "# ";
    static final String POSITION_PREFIX = "Position: ";
    static final String DEPARTMENT_PREFIX = "Department: ";

    private static final Pattern LINE_SPLIT = Pattern.compile("\\r?\\n");

    private final DividerConfig dividers;

    public DefinitionBlockParser(DividerConfig dividers) {
        this.dividers = dividers;
    }

    /**
     * 解析正文为有序的人员记录列表。
     */
    public List<PersonRecord> parse(String body, SourceContext context) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }

        String[] lines = splitLines(body);
        List<PersonRecord> records = new ArrayList<>();
        BlockState state = BlockState.IDLE;

        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            BlockTransition transition = step(state, lines[lineIndex], lineIndex, dividers);
            transition.completed().ifPresent(block -> records.add(toRecord(block, context)));
            state = transition.next();
        }
        finish(state, lines.length - 1).ifPresent(block -> records.add(toRecord(block, context)));
        return List.copyOf(records);
    }

    /**
     * 对单行执行一次状态迁移。
     *
     * <p>同一块内出现第二个标题行时覆盖姓名与起始行。
     */
    public static BlockTransition step(BlockState state, String line, int lineIndex, DividerConfig dividers) {
        if (dividers.isDivider(line)) {
            Optional<CompletedBlock> completed = complete(state, lineIndex - 1);
            return completed.map(BlockTransition::commit).orElseGet(() -> BlockTransition.to(BlockState.IDLE));
        }
        if (state.buffering()) {
            return BlockTransition.to(state.appendNotes(line));
        }
        if (line.isEmpty()) {
            return BlockTransition.to(state);
        }
        if (isNameDeclaration(line)) {
            return BlockTransition.to(state.withFullName(line.substring(NAME_PREFIX.length()).strip(), lineIndex));
        }
        if (line.startsWith(POSITION_PREFIX)) {
            return BlockTransition.to(state.withPosition(line.substring(POSITION_PREFIX.length()).strip()));
        }
        if (line.startsWith(DEPARTMENT_PREFIX)) {
            return BlockTransition.to(state.withDepartment(line.substring(DEPARTMENT_PREFIX.length()).strip()));
        }
        return BlockTransition.to(state.startNotes(line));
    }

    /**
     * 输入结束时视为隐式分隔行。
     */
    public static Optional<CompletedBlock> finish(BlockState state, int lastLineIndex) {
        return complete(state, lastLineIndex);
    }

    public static String[] splitLines(String text) {
        return LINE_SPLIT.split(text, -1);
    }

    private static boolean isNameDeclaration(String line) {
        return line.startsWith(NAME_PREFIX)
                && !line.startsWith(POSITION_PREFIX)
                && !line.startsWith(DEPARTMENT_PREFIX);
    }

    private static Optional<CompletedBlock> complete(BlockState state, int endLine) {
        if (!state.hasName()) {
            return Optional.empty();
        }
        int from = Math.max(state.startLine(), 0);
        String notes = state.notes() == null ? "" : state.notes().stripTrailing();
        return Optional.of(new CompletedBlock(
                state.fullName(),
                state.position() == null ? "" : state.position(),
                state.department() == null ? "" : state.department(),
                notes,
                new LineRange(from, Math.max(endLine, from))
        ));
    }

    private static PersonRecord toRecord(CompletedBlock block, SourceContext context) {
        return new PersonRecord(
                block.fullName(),
                block.position(),
                block.department(),
                block.notes(),
                context.documentId(),
                context.documentId() + "#" + block.fullName(),
                FileKind.CONSOLIDATED,
                block.range(),
                context.companyName(),
                context.companyLogo(),
                context.companyColor(),
                context.companyUrl()
        );
    }
}
