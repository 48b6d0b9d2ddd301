package im.arun.clausetree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Policy parameters for the clause parser. Weights and thresholds are tuned
 * against fixture behaviour; changing them moves the accepted/review/abstain
 * break points.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClauseTreeConfig {
    @JsonProperty("parser_version")
    private String parserVersion = "parser_v2_solver_v1";

    // Lexer
    @JsonProperty("xref_window_chars")
    private int xrefWindowChars = 120;

    // Graph builder
    @JsonProperty("include_invalid_edges")
    private boolean includeInvalidEdges = false;
    @JsonProperty("max_parents_per_child")
    private int maxParentsPerChild = 96;

    // Root edge scoring
    @JsonProperty("root_depth_one_preference")
    private double rootDepthOnePreference = 1.0;
    @JsonProperty("root_deeper_preference")
    private double rootDeeperPreference = 0.2;
    @JsonProperty("anchored_bonus")
    private double anchoredBonus = 1.0;
    @JsonProperty("unanchored_bonus")
    private double unanchoredBonus = 0.5;
    @JsonProperty("ordinal_start_bonus")
    private double ordinalStartBonus = 1.0;
    @JsonProperty("ordinal_continue_bonus")
    private double ordinalContinueBonus = 0.4;
    @JsonProperty("depth_penalty_per_level")
    private double depthPenaltyPerLevel = 0.25;
    @JsonProperty("edge_xref_penalty")
    private double edgeXrefPenalty = 0.35;

    // Non-root edge scoring
    @JsonProperty("depth_step_decay")
    private double depthStepDecay = 0.25;
    @JsonProperty("anchor_mismatch_score")
    private double anchorMismatchScore = 0.6;
    @JsonProperty("ordinal_mismatch_score")
    private double ordinalMismatchScore = 0.6;

    // Node (local evidence) scoring
    @JsonProperty("node_anchor_weight")
    private double nodeAnchorWeight = 0.35;
    @JsonProperty("node_line_start_weight")
    private double nodeLineStartWeight = 0.20;
    @JsonProperty("node_indentation_weight")
    private double nodeIndentationWeight = 0.10;
    @JsonProperty("node_depth_one_bias")
    private double nodeDepthOneBias = 0.15;
    @JsonProperty("node_deeper_bias")
    private double nodeDeeperBias = 0.08;
    @JsonProperty("node_xref_keyword_penalty")
    private double nodeXrefKeywordPenalty = 0.12;
    @JsonProperty("node_xref_preposition_penalty")
    private double nodeXrefPrepositionPenalty = 0.20;

    // Token decisions
    @JsonProperty("abstain_margin_threshold")
    private double abstainMarginThreshold = 0.08;
    @JsonProperty("review_margin_threshold")
    private double reviewMarginThreshold = 0.20;
    @JsonProperty("min_confidence")
    private double minConfidence = 0.12;
    @JsonProperty("single_candidate_margin")
    private double singleCandidateMargin = 0.30;

    // Section verdict
    @JsonProperty("section_abstain_ratio_threshold")
    private double sectionAbstainRatioThreshold = 0.40;
    @JsonProperty("section_review_ratio_threshold")
    private double sectionReviewRatioThreshold = 0.0;

    // Search budget
    @JsonProperty("exhaustive_search_limit")
    private int exhaustiveSearchLimit = 4096;
    @JsonProperty("beam_width")
    private int beamWidth = 64;
    @JsonProperty("top_k")
    private int topK = 5;

    // Adapter
    @JsonProperty("header_text_chars")
    private int headerTextChars = 80;

    /**
     * Field-by-field copy so callers can override without touching shared defaults.
     */
    public ClauseTreeConfig copy() {
        ClauseTreeConfig copy = new ClauseTreeConfig();
        copy.setParserVersion(parserVersion);
        copy.setXrefWindowChars(xrefWindowChars);
        copy.setIncludeInvalidEdges(includeInvalidEdges);
        copy.setMaxParentsPerChild(maxParentsPerChild);
        copy.setRootDepthOnePreference(rootDepthOnePreference);
        copy.setRootDeeperPreference(rootDeeperPreference);
        copy.setAnchoredBonus(anchoredBonus);
        copy.setUnanchoredBonus(unanchoredBonus);
        copy.setOrdinalStartBonus(ordinalStartBonus);
        copy.setOrdinalContinueBonus(ordinalContinueBonus);
        copy.setDepthPenaltyPerLevel(depthPenaltyPerLevel);
        copy.setEdgeXrefPenalty(edgeXrefPenalty);
        copy.setDepthStepDecay(depthStepDecay);
        copy.setAnchorMismatchScore(anchorMismatchScore);
        copy.setOrdinalMismatchScore(ordinalMismatchScore);
        copy.setNodeAnchorWeight(nodeAnchorWeight);
        copy.setNodeLineStartWeight(nodeLineStartWeight);
        copy.setNodeIndentationWeight(nodeIndentationWeight);
        copy.setNodeDepthOneBias(nodeDepthOneBias);
        copy.setNodeDeeperBias(nodeDeeperBias);
        copy.setNodeXrefKeywordPenalty(nodeXrefKeywordPenalty);
        copy.setNodeXrefPrepositionPenalty(nodeXrefPrepositionPenalty);
        copy.setAbstainMarginThreshold(abstainMarginThreshold);
        copy.setReviewMarginThreshold(reviewMarginThreshold);
        copy.setMinConfidence(minConfidence);
        copy.setSingleCandidateMargin(singleCandidateMargin);
        copy.setSectionAbstainRatioThreshold(sectionAbstainRatioThreshold);
        copy.setSectionReviewRatioThreshold(sectionReviewRatioThreshold);
        copy.setExhaustiveSearchLimit(exhaustiveSearchLimit);
        copy.setBeamWidth(beamWidth);
        copy.setTopK(topK);
        copy.setHeaderTextChars(headerTextChars);
        return copy;
    }
}
