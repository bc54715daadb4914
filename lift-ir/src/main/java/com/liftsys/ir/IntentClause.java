package com.liftsys.ir;

import java.util.Objects;

/**
 * 意图：自由文本摘要及可选的理由说明
 */
public final class IntentClause {
    private final String summary;
    private final String rationale;

    public IntentClause(String summary) {
        this(summary, null);
    }

    public IntentClause(String summary, String rationale) {
        this.summary = summary != null ? summary : "";
        this.rationale = rationale;
    }

    public String getSummary() { return summary; }
    public String getRationale() { return rationale; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntentClause)) return false;
        IntentClause other = (IntentClause) o;
        return summary.equals(other.summary) && Objects.equals(rationale, other.rationale);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, rationale);
    }
}
