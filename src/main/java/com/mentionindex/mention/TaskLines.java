package com.mentionindex.mention;

import com.mentionindex.model.MentionType;

import java.util.regex.Pattern;

/**
 * 任务行识别：列表标记（-、*、+ 或编号）后紧跟复选框 [ ]、[x]、[X]。
 */
public final class TaskLines {

    private static final Pattern TASK_LINE = Pattern.compile("^\\s*(?:[-*+]|\\d+\\.)\\s*\\[[ xX]]");

    private TaskLines() {
    }

    public static boolean isTask(String line) {
        return line != null && TASK_LINE.matcher(line).find();
    }

    public static MentionType classify(String line) {
        return isTask(line) ? MentionType.TASK : MentionType.TEXT;
    }
}
