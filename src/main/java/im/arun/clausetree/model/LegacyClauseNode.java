package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Clause node in the legacy clause/link contract consumed by linking and
 * review tooling, enriched with solver status fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegacyClauseNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("label")
    private String label;

    @JsonProperty("depth")
    private int depth;

    @JsonProperty("level_type")
    private String levelType;

    @JsonProperty("span_start")
    private int spanStart;

    @JsonProperty("span_end")
    private int spanEnd;

    @JsonProperty("header_text")
    private String headerText;

    @JsonProperty("parent_id")
    private String parentId;

    @JsonProperty("children_ids")
    private List<String> childrenIds;

    @JsonProperty("anchor_ok")
    private boolean anchorOk;

    @JsonProperty("run_length_ok")
    private boolean runLengthOk;

    @JsonProperty("gap_ok")
    private boolean gapOk;

    @JsonProperty("indentation_score")
    private double indentationScore;

    @JsonProperty("xref_suspected")
    private boolean xrefSuspected;

    @JsonProperty("is_structural_candidate")
    private boolean structuralCandidate;

    @JsonProperty("parse_confidence")
    private double parseConfidence;

    @JsonProperty("demotion_reason")
    private String demotionReason;

    @JsonProperty("parse_status")
    private String parseStatus;

    @JsonProperty("abstain_reason_codes")
    private List<String> abstainReasonCodes;

    @JsonProperty("solver_margin")
    private double solverMargin;
}
