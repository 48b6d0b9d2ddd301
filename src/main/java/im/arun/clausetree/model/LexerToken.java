package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One enumerator occurrence in normalized text.
 * A token may carry several candidate level types; that is how alpha/roman
 * ambiguity is kept as data instead of being resolved by the lexer.
 */
@Value
public class LexerToken {

    @JsonProperty("token_id")
    String tokenId;

    @JsonProperty("raw_label")
    String rawLabel;

    @JsonProperty("normalized_label")
    String normalizedLabel;

    @JsonProperty("position_start")
    int positionStart;

    @JsonProperty("position_end")
    int positionEnd;

    @JsonProperty("line_index")
    int lineIndex;

    @JsonProperty("column_index")
    int columnIndex;

    @JsonProperty("is_line_start")
    boolean lineStart;

    @JsonProperty("indentation_score")
    double indentationScore;

    @JsonProperty("candidate_types")
    List<LevelType> candidateTypes;

    @JsonProperty("ordinal_by_type")
    Map<LevelType, Integer> ordinalByType;

    @JsonProperty("xref_context_features")
    Map<String, Boolean> xrefContextFeatures;

    @JsonProperty("layout_features")
    Map<String, Object> layoutFeatures;

    @JsonProperty("source_span")
    SourceSpan sourceSpan;

    @Builder
    public LexerToken(String tokenId,
                      String rawLabel,
                      String normalizedLabel,
                      int positionStart,
                      int positionEnd,
                      int lineIndex,
                      int columnIndex,
                      boolean lineStart,
                      double indentationScore,
                      List<LevelType> candidateTypes,
                      Map<LevelType, Integer> ordinalByType,
                      Map<String, Boolean> xrefContextFeatures,
                      Map<String, Object> layoutFeatures,
                      SourceSpan sourceSpan) {
        if (tokenId == null || tokenId.isEmpty()) {
            throw new IllegalArgumentException("token_id cannot be empty");
        }
        if (positionStart < 0) {
            throw new IllegalArgumentException("position_start must be >= 0");
        }
        if (positionEnd <= positionStart) {
            throw new IllegalArgumentException("position_end must be > position_start");
        }
        if (lineIndex < 0 || columnIndex < 0) {
            throw new IllegalArgumentException("line_index/column_index must be >= 0");
        }
        if (indentationScore < 0.0 || indentationScore > 1.0) {
            throw new IllegalArgumentException("indentation_score must be in [0.0, 1.0]");
        }
        if (candidateTypes == null || candidateTypes.isEmpty()) {
            throw new IllegalArgumentException("candidate_types cannot be empty");
        }
        Map<LevelType, Integer> ordinals = ordinalByType == null ? Map.of() : ordinalByType;
        for (LevelType type : candidateTypes) {
            if (!ordinals.containsKey(type)) {
                throw new IllegalArgumentException("ordinal missing for candidate type " + type);
            }
        }
        this.tokenId = tokenId;
        this.rawLabel = rawLabel;
        this.normalizedLabel = normalizedLabel;
        this.positionStart = positionStart;
        this.positionEnd = positionEnd;
        this.lineIndex = lineIndex;
        this.columnIndex = columnIndex;
        this.lineStart = lineStart;
        this.indentationScore = indentationScore;
        this.candidateTypes = candidateTypes.stream().sorted().distinct().toList();
        this.ordinalByType = ordinals.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(ordinals));
        this.xrefContextFeatures = sortedCopy(xrefContextFeatures);
        this.layoutFeatures = sortedCopy(layoutFeatures);
        this.sourceSpan = sourceSpan != null ? sourceSpan : new SourceSpan(positionStart, positionEnd);
    }

    @JsonIgnore
    public boolean isAmbiguous() {
        return candidateTypes.size() > 1;
    }

    public boolean xrefFeature(String name) {
        return Boolean.TRUE.equals(xrefContextFeatures.get(name));
    }

    private static <V> Map<String, V> sortedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
