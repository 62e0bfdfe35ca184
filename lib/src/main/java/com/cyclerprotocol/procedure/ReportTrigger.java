package com.cyclerprotocol.procedure;

import java.util.Objects;

public final class ReportTrigger {
    private final ReportKind kind;
    private final String kindLabel;
    private final String value;

    public ReportTrigger(ReportKind kind, String kindLabel, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.kindLabel = kindLabel == null ? kind.name() : kindLabel;
        this.value = value == null ? "" : value;
    }

    public static ReportTrigger of(ReportKind kind, String value) {
        return new ReportTrigger(kind, null, value);
    }

    public ReportKind getKind() {
        return kind;
    }

    public String getKindLabel() {
        return kindLabel;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReportTrigger)) {
            return false;
        }
        ReportTrigger other = (ReportTrigger) obj;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kindLabel + " every " + value;
    }
}
