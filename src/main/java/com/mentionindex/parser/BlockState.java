package com.mentionindex.parser;

/**
 * 解析中的定义块缓冲，不可变。
 *
 * <p>{@code buffering} 为 true 时处于备注累积状态，此后直到分隔行的每一行都原样计入备注。
 */
public record BlockState(
        boolean buffering,
        String fullName,
        String position,
        String department,
        String notes,
        int startLine
) {

    public static final BlockState IDLE = new BlockState(false, null, null, null, null, -1);

    public BlockState withFullName(String name, int lineIndex) {
        return new BlockState(buffering, name, position, department, notes, lineIndex);
    }

    public BlockState withPosition(String value) {
        return new BlockState(buffering, fullName, value, department, notes, startLine);
    }

    public BlockState withDepartment(String value) {
        return new BlockState(buffering, fullName, position, value, notes, startLine);
    }

    public BlockState startNotes(String firstLine) {
        return new BlockState(true, fullName, position, department, firstLine + "\n", startLine);
    }

    public BlockState appendNotes(String line) {
        return new BlockState(true, fullName, position, department, notes + line + "\n", startLine);
    }

    public boolean hasName() {
        return fullName != null && !fullName.isBlank();
    }
}
