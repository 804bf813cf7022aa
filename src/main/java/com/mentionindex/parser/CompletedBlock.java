package com.mentionindex.parser;

import com.mentionindex.model.LineRange;

public record CompletedBlock(
        String fullName,
        String position,
        String department,
        String notes,
        LineRange range
) {
}
