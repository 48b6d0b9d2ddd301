package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalized section text plus reversible offset maps in both directions.
 * One instance per section; the offset arrays are never exposed for mutation.
 */
@Value
public class NormalizedText {
    public static final String NORMALIZATION_VERSION = "parser_v2_norm_v1";

    @JsonProperty("raw_text")
    String rawText;

    @JsonProperty("normalized_text")
    String normalizedText;

    @JsonProperty("raw_to_normalized")
    int[] rawToNormalized;

    @JsonProperty("normalized_to_raw")
    int[] normalizedToRaw;

    @JsonProperty("normalization_flags")
    Map<String, Boolean> normalizationFlags;

    @JsonProperty("normalization_version")
    String normalizationVersion;

    public NormalizedText(String rawText,
                          String normalizedText,
                          int[] rawToNormalized,
                          int[] normalizedToRaw,
                          Map<String, Boolean> normalizationFlags) {
        if (rawText == null || normalizedText == null) {
            throw new IllegalArgumentException("raw_text and normalized_text cannot be null");
        }
        if (rawToNormalized == null || rawToNormalized.length != rawText.length() + 1) {
            throw new IllegalArgumentException("raw_to_normalized length must equal len(raw_text) + 1");
        }
        if (normalizedToRaw == null || normalizedToRaw.length != normalizedText.length() + 1) {
            throw new IllegalArgumentException("normalized_to_raw length must equal len(normalized_text) + 1");
        }
        this.rawText = rawText;
        this.normalizedText = normalizedText;
        this.rawToNormalized = rawToNormalized.clone();
        this.normalizedToRaw = normalizedToRaw.clone();
        this.normalizationFlags = Collections.unmodifiableMap(
            new TreeMap<>(normalizationFlags == null ? Map.of() : normalizationFlags));
        this.normalizationVersion = NORMALIZATION_VERSION;
    }

    public int[] getRawToNormalized() {
        return rawToNormalized.clone();
    }

    public int[] getNormalizedToRaw() {
        return normalizedToRaw.clone();
    }

    /**
     * Normalized offset for a raw offset in {@code [0, len(raw)]}.
     */
    public int toNormalized(int rawOffset) {
        return rawToNormalized[rawOffset];
    }

    /**
     * Raw offset for a normalized offset in {@code [0, len(normalized)]}.
     * Offsets inside a collapsed region map to the start of that region.
     */
    public int toRaw(int normalizedOffset) {
        return normalizedToRaw[normalizedOffset];
    }

    public boolean flag(String name) {
        return Boolean.TRUE.equals(normalizationFlags.get(name));
    }
}
