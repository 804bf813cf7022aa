package com.mentionindex.model;

public record MentionRanking(String fullName, int count) {
}
