package com.mentionindex.model;

public enum MentionType {
    TEXT,
    TASK
}
