package com.liftsys.compiler.analysis;

import java.util.Comparator;
import java.util.Objects;

/**
 * IR 语义问题。
 *
 * <p>值对象：相等性只看 (kind, location)，用于跨分析器去重。</p>
 */
public final class SemanticIssue {

    public enum Kind {
        MISSING_RETURN,
        MISSING_BRANCH,
        LOOP_BEHAVIOR_MISMATCH,
        TYPE_MISMATCH,
        UNREACHABLE_CODE,
        VARIABLE_SHADOWING,
        DANGLING_REFERENCE,
        VOID_RETURN_VALUE,
        UNUSED_PARAMETER,
        UNCHECKABLE_ASSERTION
    }

    /** 严重级别：ERROR 阻断生成，WARNING 仅作提示 */
    public enum Severity {
        ERROR, WARNING;

        /** 是否比 other 更严重 */
        public boolean isMoreSevereThan(Severity other) {
            return ordinal() < other.ordinal();
        }
    }

    /** 按位置升序，无位置的排在最前 */
    public static final Comparator<SemanticIssue> BY_LOCATION = new Comparator<SemanticIssue>() {
        @Override
        public int compare(SemanticIssue a, SemanticIssue b) {
            if (a.location == null) return b.location == null ? 0 : -1;
            if (b.location == null) return 1;
            return Integer.compare(a.location, b.location);
        }
    };

    private final Kind kind;
    private final Severity severity;
    private final Integer location;
    private final String message;
    private final String suggestion;

    public SemanticIssue(Kind kind, Severity severity, Integer location, String message, String suggestion) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.location = location;
        this.message = Objects.requireNonNull(message, "message");
        this.suggestion = suggestion;
    }

    public static SemanticIssue error(Kind kind, Integer location, String message) {
        return new SemanticIssue(kind, Severity.ERROR, location, message, null);
    }

    public static SemanticIssue warning(Kind kind, Integer location, String message) {
        return new SemanticIssue(kind, Severity.WARNING, location, message, null);
    }

    public SemanticIssue withSuggestion(String hint) {
        return new SemanticIssue(kind, severity, location, message, hint);
    }

    public Kind getKind() { return kind; }
    public Severity getSeverity() { return severity; }
    /** Effect 位置；与具体 Effect 无关的问题为 null */
    public Integer getLocation() { return location; }
    public String getMessage() { return message; }
    public String getSuggestion() { return suggestion; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticIssue)) return false;
        SemanticIssue other = (SemanticIssue) o;
        return kind == other.kind && Objects.equals(location, other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(kind);
        if (location != null) sb.append(" @").append(location);
        sb.append(": ").append(message);
        if (suggestion != null) sb.append(" (建议: ").append(suggestion).append(')');
        return sb.toString();
    }
}
