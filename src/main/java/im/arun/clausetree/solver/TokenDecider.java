package im.arun.clausetree.solver;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParseStatus;
import im.arun.clausetree.model.ReasonCode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-token accept/review/abstain decisions from local evidence.
 */
class TokenDecider {
    private final ClauseTreeConfig config;
    private final ScoringModel scoring;

    TokenDecider(ClauseTreeConfig config, ScoringModel scoring) {
        this.config = config;
        this.scoring = scoring;
    }

    /**
     * Decisions in token order.
     */
    List<TokenDecision> decide(CandidateGraph graph) {
        Map<String, List<ClauseNodeCandidate>> byToken = new LinkedHashMap<>();
        for (ClauseNodeCandidate node : graph.getNodeCandidates()) {
            byToken.computeIfAbsent(node.getTokenId(), k -> new ArrayList<>()).add(node);
        }

        List<TokenDecision> decisions = new ArrayList<>(byToken.size());
        for (Map.Entry<String, List<ClauseNodeCandidate>> entry : byToken.entrySet()) {
            decisions.add(decideToken(entry.getKey(), entry.getValue()));
        }
        decisions.sort(Comparator.comparingInt(TokenDecision::getTokenIndex)
            .thenComparing(TokenDecision::getTokenId));
        return decisions;
    }

    private TokenDecision decideToken(String tokenId, List<ClauseNodeCandidate> candidates) {
        Map<String, Double> scores = new HashMap<>();
        for (ClauseNodeCandidate candidate : candidates) {
            scores.put(candidate.getNodeCandidateId(), scoring.nodeScore(candidate));
        }
        List<ClauseNodeCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator
            .comparingDouble((ClauseNodeCandidate c) -> -scores.get(c.getNodeCandidateId()))
            .thenComparingInt(ClauseNodeCandidate::getDepthHint)
            .thenComparing(ClauseNodeCandidate::getNodeCandidateId));

        ClauseNodeCandidate top = ranked.get(0);
        double top1 = scores.get(top.getNodeCandidateId());
        double top2 = ranked.size() > 1
            ? scores.get(ranked.get(1).getNodeCandidateId())
            : Math.max(0.0, top1 - config.getSingleCandidateMargin());
        double margin = ScoringModel.round6(Math.max(0.0, top1 - top2));
        boolean ambiguous = ranked.size() > 1;
        boolean xref = top.feature(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE);

        List<ReasonCode> reasons = new ArrayList<>();
        ParseStatus status;
        boolean lowConfidence = top1 < config.getMinConfidence();
        if (lowConfidence || margin < config.getAbstainMarginThreshold()) {
            status = ParseStatus.ABSTAIN;
            reasons.add(lowConfidence ? ReasonCode.LOW_CONFIDENCE : ReasonCode.LOW_MARGIN);
            if (ambiguous) {
                reasons.add(ReasonCode.INSUFFICIENT_CONTEXT);
            }
            if (xref) {
                reasons.add(ReasonCode.XREF_CONFLICT);
            }
        } else {
            if (margin < config.getReviewMarginThreshold()) {
                reasons.add(ReasonCode.LOW_MARGIN);
            }
            if (xref) {
                reasons.add(ReasonCode.XREF_CONFLICT);
            }
            if (!top.feature(ClauseNodeCandidate.FEATURE_ANCHOR)) {
                reasons.add(ReasonCode.LAYOUT_UNCERTAIN);
            }
            status = reasons.isEmpty() ? ParseStatus.ACCEPTED : ParseStatus.REVIEW;
        }

        return new TokenDecision(
            tokenId,
            top.getTokenIndex(),
            List.copyOf(ranked),
            Map.copyOf(scores),
            status,
            reasons.stream().sorted(ReasonCode.BY_WIRE_NAME).toList(),
            margin,
            top1,
            ambiguous,
            xref);
    }
}
