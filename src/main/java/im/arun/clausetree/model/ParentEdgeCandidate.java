package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Directed parent hypothesis: child to parent, or child to the section root.
 */
@Value
public class ParentEdgeCandidate {

    @JsonProperty("edge_id")
    String edgeId;

    @JsonProperty("child_candidate_id")
    String childCandidateId;

    /** Empty for root edges. */
    @JsonProperty("parent_candidate_id")
    String parentCandidateId;

    @JsonProperty("root")
    boolean root;

    @JsonProperty("hard_valid")
    boolean hardValid;

    @JsonProperty("hard_invalid_reasons")
    List<String> hardInvalidReasons;

    @JsonProperty("soft_score_components")
    Map<String, Double> softScoreComponents;

    @JsonProperty("edge_penalties")
    Map<String, Double> edgePenalties;

    @Builder
    public ParentEdgeCandidate(String edgeId,
                               String childCandidateId,
                               String parentCandidateId,
                               boolean root,
                               boolean hardValid,
                               List<String> hardInvalidReasons,
                               Map<String, Double> softScoreComponents,
                               Map<String, Double> edgePenalties) {
        List<String> reasons = hardInvalidReasons == null ? List.of() : List.copyOf(hardInvalidReasons);
        String parentId = parentCandidateId == null ? "" : parentCandidateId;
        if (edgeId == null || edgeId.isEmpty()) {
            throw new IllegalArgumentException("edge_id cannot be empty");
        }
        if (childCandidateId == null || childCandidateId.isEmpty()) {
            throw new IllegalArgumentException("child_candidate_id cannot be empty");
        }
        if (root && !parentId.isEmpty()) {
            throw new IllegalArgumentException("root edge must not carry parent_candidate_id");
        }
        if (root && !reasons.isEmpty()) {
            throw new IllegalArgumentException("root edge must not carry hard_invalid_reasons");
        }
        if (!root && parentId.isEmpty()) {
            throw new IllegalArgumentException("non-root edge must carry parent_candidate_id");
        }
        if (hardValid && !reasons.isEmpty()) {
            throw new IllegalArgumentException("hard_valid edge cannot have hard_invalid_reasons");
        }
        this.edgeId = edgeId;
        this.childCandidateId = childCandidateId;
        this.parentCandidateId = parentId;
        this.root = root;
        this.hardValid = hardValid;
        this.hardInvalidReasons = reasons;
        this.softScoreComponents = sortedCopy(softScoreComponents);
        this.edgePenalties = sortedCopy(edgePenalties);
    }

    @JsonIgnore
    public double getSoftScoreTotal() {
        return softScoreComponents.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @JsonIgnore
    public double getPenaltyTotal() {
        return edgePenalties.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    private static Map<String, Double> sortedCopy(Map<String, Double> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
