package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence bucket for a node or a whole section.
 */
public enum ParseStatus {
    ACCEPTED("accepted"),
    REVIEW("review"),
    ABSTAIN("abstain");

    private final String wireName;

    ParseStatus(String wireName) {
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
