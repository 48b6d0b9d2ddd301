package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * A token the solver declined to place in the tree, with the candidates it
 * could not choose between.
 */
@Value
public class AbstainedToken {

    @JsonProperty("token_id")
    String tokenId;

    @JsonProperty("node_candidate_ids")
    List<String> nodeCandidateIds;

    @JsonProperty("reason_codes")
    List<ReasonCode> reasonCodes;

    @JsonProperty("solver_margin")
    double solverMargin;

    @JsonProperty("confidence_score")
    double confidenceScore;

    public AbstainedToken(String tokenId,
                          List<String> nodeCandidateIds,
                          List<ReasonCode> reasonCodes,
                          double solverMargin,
                          double confidenceScore) {
        if (reasonCodes == null || reasonCodes.isEmpty()) {
            throw new IllegalArgumentException("abstained token must include reason codes");
        }
        this.tokenId = tokenId;
        this.nodeCandidateIds = List.copyOf(nodeCandidateIds);
        this.reasonCodes = reasonCodes.stream().distinct().sorted(ReasonCode.BY_WIRE_NAME).toList();
        this.solverMargin = solverMargin;
        this.confidenceScore = confidenceScore;
    }
}
