package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One (token, level type) interpretation the solver may or may not select.
 */
@Value
public class ClauseNodeCandidate {
    public static final String FEATURE_ANCHOR = "anchor";
    public static final String FEATURE_LINE_START = "line_start";
    public static final String FEATURE_INDENTATION = "indentation";
    public static final String FEATURE_XREF_KEYWORD_PRE = "xref_keyword_pre";
    public static final String FEATURE_XREF_KEYWORD_POST = "xref_keyword_post";
    public static final String FEATURE_XREF_PREPOSITION_PRE = "xref_preposition_pre";

    @JsonProperty("node_candidate_id")
    String nodeCandidateId;

    @JsonProperty("token_id")
    String tokenId;

    @JsonProperty("token_index")
    int tokenIndex;

    @JsonProperty("level_type")
    LevelType levelType;

    @JsonProperty("ordinal")
    int ordinal;

    @JsonProperty("depth_hint")
    int depthHint;

    @JsonProperty("span_start")
    int spanStart;

    @JsonProperty("span_end")
    int spanEnd;

    @JsonProperty("raw_label")
    String rawLabel;

    @JsonProperty("normalized_label")
    String normalizedLabel;

    @JsonProperty("feature_vector")
    Map<String, Object> featureVector;

    @Builder
    public ClauseNodeCandidate(String nodeCandidateId,
                               String tokenId,
                               int tokenIndex,
                               LevelType levelType,
                               int ordinal,
                               int depthHint,
                               int spanStart,
                               int spanEnd,
                               String rawLabel,
                               String normalizedLabel,
                               Map<String, Object> featureVector) {
        if (nodeCandidateId == null || nodeCandidateId.isEmpty()) {
            throw new IllegalArgumentException("node_candidate_id cannot be empty");
        }
        if (tokenId == null || tokenId.isEmpty()) {
            throw new IllegalArgumentException("token_id cannot be empty");
        }
        if (levelType == null) {
            throw new IllegalArgumentException("level_type cannot be null");
        }
        if (tokenIndex < 0) {
            throw new IllegalArgumentException("token_index must be >= 0");
        }
        if (ordinal <= 0) {
            throw new IllegalArgumentException("ordinal must be > 0");
        }
        if (depthHint <= 0) {
            throw new IllegalArgumentException("depth_hint must be > 0");
        }
        if (spanStart < 0) {
            throw new IllegalArgumentException("span_start must be >= 0");
        }
        if (spanEnd <= spanStart) {
            throw new IllegalArgumentException("span_end must be > span_start");
        }
        this.nodeCandidateId = nodeCandidateId;
        this.tokenId = tokenId;
        this.tokenIndex = tokenIndex;
        this.levelType = levelType;
        this.ordinal = ordinal;
        this.depthHint = depthHint;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.rawLabel = rawLabel;
        this.normalizedLabel = normalizedLabel;
        this.featureVector = featureVector == null || featureVector.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(featureVector));
    }

    @JsonIgnore
    public SourceSpan getSpan() {
        return new SourceSpan(spanStart, spanEnd);
    }

    public boolean feature(String name) {
        return Boolean.TRUE.equals(featureVector.get(name));
    }

    public double numericFeature(String name) {
        Object value = featureVector.get(name);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
