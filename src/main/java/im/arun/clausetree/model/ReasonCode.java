package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Machine-readable explanation attached to review and abstain outcomes.
 * Wire names are consumed by downstream review tooling and must not change.
 */
public enum ReasonCode {
    LOW_MARGIN("low_margin"),
    LOW_CONFIDENCE("low_confidence"),
    INSUFFICIENT_CONTEXT("insufficient_context"),
    XREF_CONFLICT("xref_conflict"),
    LAYOUT_UNCERTAIN("layout_uncertain"),
    STRUCTURE_CONFLICT("structure_conflict"),
    PARENT_CONFLICT("parent_conflict"),
    SEARCH_TRUNCATED("search_truncated");

    /** Sort order used wherever reason codes are serialized. */
    public static final Comparator<ReasonCode> BY_WIRE_NAME = Comparator.comparing(ReasonCode::wireName);

    private final String wireName;

    ReasonCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
