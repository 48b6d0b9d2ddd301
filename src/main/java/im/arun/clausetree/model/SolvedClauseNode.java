package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A node of the solved clause tree.
 */
@Value
public class SolvedClauseNode {

    @JsonProperty("node_candidate_id")
    String nodeCandidateId;

    /** Dotted path such as {@code a.i.A}. */
    @JsonProperty("clause_id")
    String clauseId;

    /** Clause id of the parent, empty for section-level nodes. */
    @JsonProperty("parent_id")
    String parentId;

    @JsonProperty("depth")
    int depth;

    @JsonProperty("level_type")
    LevelType levelType;

    @JsonProperty("span_start")
    int spanStart;

    @JsonProperty("span_end")
    int spanEnd;

    @JsonProperty("is_structural_candidate")
    boolean structuralCandidate;

    @JsonProperty("xref_suspected")
    boolean xrefSuspected;

    @JsonProperty("parse_status")
    ParseStatus parseStatus;

    @JsonProperty("abstain_reason_codes")
    List<ReasonCode> abstainReasonCodes;

    @JsonProperty("review_reason_codes")
    List<ReasonCode> reviewReasonCodes;

    @JsonProperty("solver_margin")
    double solverMargin;

    @JsonProperty("confidence_score")
    double confidenceScore;

    @Builder
    public SolvedClauseNode(String nodeCandidateId,
                            String clauseId,
                            String parentId,
                            int depth,
                            LevelType levelType,
                            int spanStart,
                            int spanEnd,
                            boolean structuralCandidate,
                            boolean xrefSuspected,
                            ParseStatus parseStatus,
                            List<ReasonCode> abstainReasonCodes,
                            List<ReasonCode> reviewReasonCodes,
                            double solverMargin,
                            double confidenceScore) {
        List<ReasonCode> abstainCodes = abstainReasonCodes == null ? List.of() : sorted(abstainReasonCodes);
        List<ReasonCode> reviewCodes = reviewReasonCodes == null ? List.of() : sorted(reviewReasonCodes);
        if (clauseId == null || clauseId.isEmpty()) {
            throw new IllegalArgumentException("clause_id cannot be empty");
        }
        if (spanStart < 0) {
            throw new IllegalArgumentException("span_start must be >= 0");
        }
        if (spanEnd <= spanStart) {
            throw new IllegalArgumentException("span_end must be > span_start");
        }
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be > 0");
        }
        if (parseStatus == null) {
            throw new IllegalArgumentException("parse_status cannot be null");
        }
        if ((parseStatus == ParseStatus.ABSTAIN) == abstainCodes.isEmpty()) {
            throw new IllegalArgumentException("abstain_reason_codes must be non-empty exactly when status is abstain");
        }
        if ((parseStatus == ParseStatus.REVIEW) == reviewCodes.isEmpty()) {
            throw new IllegalArgumentException("review_reason_codes must be non-empty exactly when status is review");
        }
        this.nodeCandidateId = nodeCandidateId;
        this.clauseId = clauseId;
        this.parentId = parentId == null ? "" : parentId;
        this.depth = depth;
        this.levelType = levelType;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.structuralCandidate = structuralCandidate;
        this.xrefSuspected = xrefSuspected;
        this.parseStatus = parseStatus;
        this.abstainReasonCodes = abstainCodes;
        this.reviewReasonCodes = reviewCodes;
        this.solverMargin = solverMargin;
        this.confidenceScore = confidenceScore;
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId.isEmpty();
    }

    private static List<ReasonCode> sorted(List<ReasonCode> codes) {
        return codes.stream().distinct().sorted(ReasonCode.BY_WIRE_NAME).toList();
    }
}
