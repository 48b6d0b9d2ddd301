package im.arun.clausetree.solver;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParentEdgeCandidate;

/**
 * Local evidence scores for node candidates and parent edges.
 * All scores are rounded to six decimals so totals stay reproducible.
 */
public class ScoringModel {
    private final ClauseTreeConfig config;

    public ScoringModel(ClauseTreeConfig config) {
        this.config = config;
    }

    /**
     * Layout evidence minus cross-reference evidence, clamped to [0, 1].
     */
    public double nodeScore(ClauseNodeCandidate node) {
        double score = 0.0;
        if (node.feature(ClauseNodeCandidate.FEATURE_ANCHOR)) {
            score += config.getNodeAnchorWeight();
        }
        if (node.feature(ClauseNodeCandidate.FEATURE_LINE_START)) {
            score += config.getNodeLineStartWeight();
        }
        score += config.getNodeIndentationWeight() * node.numericFeature(ClauseNodeCandidate.FEATURE_INDENTATION);
        score += node.getDepthHint() == 1 ? config.getNodeDepthOneBias() : config.getNodeDeeperBias();
        if (node.feature(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_PRE)) {
            score -= config.getNodeXrefKeywordPenalty();
        }
        if (node.feature(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE)) {
            score -= config.getNodeXrefPrepositionPenalty();
        }
        return round6(clamp01(score));
    }

    public double edgeScore(ParentEdgeCandidate edge) {
        return round6(edge.getSoftScoreTotal() - edge.getPenaltyTotal());
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double round6(double value) {
        return Math.round(value * 1_000_000.0) / 1_000_000.0;
    }
}
