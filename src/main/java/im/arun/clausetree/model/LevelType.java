package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Numbering system of an enumerator.
 * Declaration order is the canonical order (alpha &lt; roman &lt; caps &lt; numeric)
 * and the depth hint is a fixed lookup, not something a token decides.
 */
public enum LevelType {
    ALPHA("alpha", 1),
    ROMAN("roman", 2),
    CAPS("caps", 3),
    NUMERIC("numeric", 4);

    private final String wireName;
    private final int canonicalDepth;

    LevelType(String wireName, int canonicalDepth) {
        this.wireName = wireName;
        this.canonicalDepth = canonicalDepth;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int canonicalDepth() {
        return canonicalDepth;
    }

    @JsonCreator
    public static LevelType fromWireName(String value) {
        for (LevelType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown level type: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
