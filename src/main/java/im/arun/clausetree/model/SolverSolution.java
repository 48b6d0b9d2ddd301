package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-section solver result. Always complete: low confidence is expressed
 * through statuses and reason codes, never by a missing solution.
 */
@Value
public class SolverSolution {

    @JsonProperty("parse_run_id")
    String parseRunId;

    @JsonProperty("parser_version")
    String parserVersion;

    @JsonProperty("section_key")
    String sectionKey;

    @JsonProperty("selected_node_candidates")
    List<String> selectedNodeCandidates;

    @JsonProperty("selected_parent_edges")
    List<String> selectedParentEdges;

    @JsonProperty("abstained_token_ids")
    List<String> abstainedTokenIds;

    @JsonProperty("abstained_tokens")
    List<AbstainedToken> abstainedTokens;

    @JsonProperty("objective_score")
    double objectiveScore;

    @JsonProperty("objective_components")
    Map<String, Double> objectiveComponents;

    @JsonProperty("top_k_alternatives")
    List<SolutionAlternative> topKAlternatives;

    @JsonProperty("solver_diagnostics")
    Map<String, Object> solverDiagnostics;

    @JsonProperty("nodes")
    List<SolvedClauseNode> nodes;

    @JsonProperty("section_parse_status")
    ParseStatus sectionParseStatus;

    @JsonProperty("section_reason_codes")
    List<ReasonCode> sectionReasonCodes;

    @JsonProperty("critical_node_abstain_ratio")
    double criticalNodeAbstainRatio;

    @JsonProperty("top1_score")
    double top1Score;

    @JsonProperty("top2_score")
    double top2Score;

    @JsonProperty("margin_abs")
    double marginAbs;

    @JsonProperty("margin_ratio")
    double marginRatio;

    @Builder
    public SolverSolution(String parseRunId,
                          String parserVersion,
                          String sectionKey,
                          List<String> selectedNodeCandidates,
                          List<String> selectedParentEdges,
                          List<String> abstainedTokenIds,
                          List<AbstainedToken> abstainedTokens,
                          double objectiveScore,
                          Map<String, Double> objectiveComponents,
                          List<SolutionAlternative> topKAlternatives,
                          Map<String, Object> solverDiagnostics,
                          List<SolvedClauseNode> nodes,
                          ParseStatus sectionParseStatus,
                          List<ReasonCode> sectionReasonCodes,
                          double criticalNodeAbstainRatio,
                          double top1Score,
                          double top2Score,
                          double marginAbs,
                          double marginRatio) {
        if (sectionParseStatus == null) {
            throw new IllegalArgumentException("section_parse_status cannot be null");
        }
        if (criticalNodeAbstainRatio < 0.0 || criticalNodeAbstainRatio > 1.0) {
            throw new IllegalArgumentException("critical_node_abstain_ratio must be in [0.0, 1.0]");
        }
        this.parseRunId = parseRunId;
        this.parserVersion = parserVersion;
        this.sectionKey = sectionKey;
        this.selectedNodeCandidates = copy(selectedNodeCandidates);
        this.selectedParentEdges = copy(selectedParentEdges);
        this.abstainedTokenIds = copy(abstainedTokenIds);
        this.abstainedTokens = copy(abstainedTokens);
        this.objectiveScore = objectiveScore;
        this.objectiveComponents = objectiveComponents == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(objectiveComponents));
        this.topKAlternatives = copy(topKAlternatives);
        this.solverDiagnostics = solverDiagnostics == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(solverDiagnostics));
        this.nodes = copy(nodes);
        this.sectionParseStatus = sectionParseStatus;
        this.sectionReasonCodes = sectionReasonCodes == null
            ? List.of()
            : sectionReasonCodes.stream().distinct().sorted(ReasonCode.BY_WIRE_NAME).toList();
        this.criticalNodeAbstainRatio = criticalNodeAbstainRatio;
        this.top1Score = top1Score;
        this.top2Score = top2Score;
        this.marginAbs = marginAbs;
        this.marginRatio = marginRatio;
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? List.of() : List.copyOf(source);
    }
}
