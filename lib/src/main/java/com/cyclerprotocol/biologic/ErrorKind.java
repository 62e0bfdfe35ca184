package com.cyclerprotocol.biologic;

/** Why a conversion was aborted. Every kind is fatal to the conversion call that raised it. */
public enum ErrorKind {
    GOTO_OUTSIDE_LOOP(Category.STRUCTURAL_VIOLATION),
    ADVANCE_CYCLE_AT_START(Category.STRUCTURAL_VIOLATION),
    UNBALANCED_LOOP(Category.STRUCTURAL_VIOLATION),
    TOO_MANY_LIMITS(Category.FORMAT_CAPACITY_EXCEEDED),
    TOO_MANY_REPORTS(Category.FORMAT_CAPACITY_EXCEEDED),
    FIELD_TOO_WIDE(Category.FORMAT_CAPACITY_EXCEEDED),
    MISSING_FIELD(Category.FORMAT_CAPACITY_EXCEEDED),
    UNSUPPORTED_STEP(Category.UNSUPPORTED_CONSTRUCT),
    UNSUPPORTED_END_CONDITION(Category.UNSUPPORTED_CONSTRUCT),
    UNSUPPORTED_REPORT_TYPE(Category.UNSUPPORTED_CONSTRUCT),
    MISSING_LOOP_COUNT(Category.UNSUPPORTED_CONSTRUCT);

    public enum Category {
        STRUCTURAL_VIOLATION,
        FORMAT_CAPACITY_EXCEEDED,
        UNSUPPORTED_CONSTRUCT
    }

    private final Category category;

    ErrorKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
