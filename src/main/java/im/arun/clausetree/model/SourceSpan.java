package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Character span in normalized text, end exclusive.
 */
@Value
public class SourceSpan {

    @JsonProperty("char_start")
    int charStart;

    @JsonProperty("char_end")
    int charEnd;

    public SourceSpan(int charStart, int charEnd) {
        if (charStart < 0) {
            throw new IllegalArgumentException("char_start must be >= 0, got " + charStart);
        }
        if (charEnd <= charStart) {
            throw new IllegalArgumentException(
                "char_end must be > char_start, got " + charEnd + " <= " + charStart);
        }
        this.charStart = charStart;
        this.charEnd = charEnd;
    }

    public int length() {
        return charEnd - charStart;
    }

    public boolean overlaps(SourceSpan other) {
        return charStart < other.charEnd && other.charStart < charEnd;
    }

    public SourceSpan shift(int offset) {
        return new SourceSpan(charStart + offset, charEnd + offset);
    }
}
