package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Section-level transport wrapper for evidence and review systems.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkContractPayload {

    @JsonProperty("parse_run_id")
    private String parseRunId;

    @JsonProperty("parser_version")
    private String parserVersion;

    @JsonProperty("section_key")
    private String sectionKey;

    @JsonProperty("section_parse_status")
    private String sectionParseStatus;

    @JsonProperty("section_reason_codes")
    private List<String> sectionReasonCodes;

    @JsonProperty("critical_node_abstain_ratio")
    private double criticalNodeAbstainRatio;

    @JsonProperty("abstained_token_ids")
    private List<String> abstainedTokenIds;

    @JsonProperty("nodes")
    private List<LegacyClauseNode> nodes;
}
