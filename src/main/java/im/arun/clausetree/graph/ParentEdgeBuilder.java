package im.arun.clausetree.graph;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParentEdgeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Generates parent-edge hypotheses between node candidates.
 * <p>
 * Every candidate gets a root edge. Non-root parents are scanned nearest
 * first among candidates that sort earlier, bounded by
 * {@code max_parents_per_child}. A non-root edge is hard-valid only when the
 * parent is on another token, starts strictly earlier, and is strictly
 * shallower.
 */
public class ParentEdgeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ParentEdgeBuilder.class);

    public static final String REASON_SAME_TOKEN = "same_token_parent";
    public static final String REASON_SPAN_ORDER = "span_ordering_invalid";
    public static final String REASON_DEPTH = "depth_transition_invalid";

    public static final String ROOT_DEPTH_PREFERENCE = "root_depth_preference";
    public static final String ANCHOR_BONUS = "anchor_bonus";
    public static final String ORDINAL_START_BONUS = "ordinal_start_bonus";
    public static final String DEPTH_PENALTY = "depth_penalty";
    public static final String DEPTH_TRANSITION = "depth_transition";
    public static final String ANCHOR_COMPATIBILITY = "anchor_compatibility";
    public static final String ORDINAL_PROXIMITY = "ordinal_proximity";
    public static final String DEPTH_GAP_PENALTY = "depth_gap_penalty";
    public static final String XREF_PENALTY = "xref_penalty";

    static final Comparator<ClauseNodeCandidate> PARENT_SCAN_ORDER = Comparator
        .comparingInt(ClauseNodeCandidate::getSpanStart)
        .thenComparingInt(ClauseNodeCandidate::getDepthHint)
        .thenComparingInt(ClauseNodeCandidate::getTokenIndex)
        .thenComparing(ClauseNodeCandidate::getNodeCandidateId);

    private final ClauseTreeConfig config;

    public ParentEdgeBuilder(ClauseTreeConfig config) {
        this.config = config;
    }

    public EdgeBuildResult build(List<ClauseNodeCandidate> nodeCandidates) {
        return build(nodeCandidates, config.isIncludeInvalidEdges(), config.getMaxParentsPerChild());
    }

    public EdgeBuildResult build(List<ClauseNodeCandidate> nodeCandidates,
                                 boolean includeInvalidEdges,
                                 int maxParentsPerChild) {
        List<ClauseNodeCandidate> ordered = new ArrayList<>(nodeCandidates);
        ordered.sort(PARENT_SCAN_ORDER);

        Map<String, Integer> pruned = new TreeMap<>();
        List<String> warnings = new ArrayList<>();
        List<ParentEdgeCandidate> edges = new ArrayList<>();

        for (int idx = 0; idx < ordered.size(); idx++) {
            ClauseNodeCandidate child = ordered.get(idx);
            edges.add(rootEdge(child));
            int considered = 0;
            int validNonRoot = 0;

            for (int p = idx - 1; p >= 0; p--) {
                if (considered >= maxParentsPerChild) {
                    break;
                }
                considered++;
                ClauseNodeCandidate parent = ordered.get(p);
                List<String> reasons = invalidReasons(parent, child);
                boolean hardValid = reasons.isEmpty();
                if (!hardValid && !includeInvalidEdges) {
                    for (String reason : reasons) {
                        pruned.merge(reason, 1, Integer::sum);
                    }
                    continue;
                }
                edges.add(nonRootEdge(parent, child, reasons));
                if (hardValid) {
                    validNonRoot++;
                }
            }

            if (child.getDepthHint() > 1 && validNonRoot == 0) {
                warnings.add("child_without_non_root_parent:" + child.getNodeCandidateId()
                    + ":depth=" + child.getDepthHint());
            }
        }

        verifyEndpoints(ordered, edges);
        logger.debug("Built {} edge candidates for {} nodes, pruned={}", edges.size(), ordered.size(), pruned);
        return new EdgeBuildResult(List.copyOf(edges), pruned, List.copyOf(warnings));
    }

    private static List<String> invalidReasons(ClauseNodeCandidate parent, ClauseNodeCandidate child) {
        List<String> reasons = new ArrayList<>(3);
        if (parent.getTokenId().equals(child.getTokenId())) {
            reasons.add(REASON_SAME_TOKEN);
        }
        if (parent.getSpanStart() >= child.getSpanStart()) {
            reasons.add(REASON_SPAN_ORDER);
        }
        if (parent.getDepthHint() >= child.getDepthHint()) {
            reasons.add(REASON_DEPTH);
        }
        return reasons;
    }

    private ParentEdgeCandidate rootEdge(ClauseNodeCandidate child) {
        Map<String, Double> soft = new LinkedHashMap<>();
        soft.put(ROOT_DEPTH_PREFERENCE, child.getDepthHint() == 1
            ? config.getRootDepthOnePreference() : config.getRootDeeperPreference());
        soft.put(ANCHOR_BONUS, child.feature(ClauseNodeCandidate.FEATURE_ANCHOR)
            ? config.getAnchoredBonus() : config.getUnanchoredBonus());
        soft.put(ORDINAL_START_BONUS, child.getOrdinal() == 1
            ? config.getOrdinalStartBonus() : config.getOrdinalContinueBonus());

        Map<String, Double> penalties = new LinkedHashMap<>();
        penalties.put(DEPTH_PENALTY, Math.max(0.0, (child.getDepthHint() - 1) * config.getDepthPenaltyPerLevel()));
        penalties.put(XREF_PENALTY, xrefPenalty(child));

        return ParentEdgeCandidate.builder()
            .edgeId("edge_root__" + child.getNodeCandidateId())
            .childCandidateId(child.getNodeCandidateId())
            .parentCandidateId("")
            .root(true)
            .hardValid(true)
            .softScoreComponents(soft)
            .edgePenalties(penalties)
            .build();
    }

    private ParentEdgeCandidate nonRootEdge(ClauseNodeCandidate parent, ClauseNodeCandidate child,
                                            List<String> reasons) {
        int depthStep = Math.max(1, child.getDepthHint() - parent.getDepthHint());
        boolean bothAnchored = parent.feature(ClauseNodeCandidate.FEATURE_ANCHOR)
            && child.feature(ClauseNodeCandidate.FEATURE_ANCHOR);
        boolean ordinalFollows = child.getOrdinal() >= parent.getOrdinal()
            && child.getDepthHint() == parent.getDepthHint() + 1;

        Map<String, Double> soft = new LinkedHashMap<>();
        soft.put(DEPTH_TRANSITION, depthStep == 1
            ? 1.0 : Math.max(0.0, 1.0 - config.getDepthStepDecay() * (depthStep - 1)));
        soft.put(ANCHOR_COMPATIBILITY, bothAnchored ? 1.0 : config.getAnchorMismatchScore());
        soft.put(ORDINAL_PROXIMITY, ordinalFollows ? 1.0 : config.getOrdinalMismatchScore());

        Map<String, Double> penalties = new LinkedHashMap<>();
        penalties.put(DEPTH_GAP_PENALTY, Math.max(0.0, (depthStep - 1) * config.getDepthPenaltyPerLevel()));
        penalties.put(XREF_PENALTY, xrefPenalty(child));

        return ParentEdgeCandidate.builder()
            .edgeId("edge_" + parent.getNodeCandidateId() + "__" + child.getNodeCandidateId())
            .childCandidateId(child.getNodeCandidateId())
            .parentCandidateId(parent.getNodeCandidateId())
            .root(false)
            .hardValid(reasons.isEmpty())
            .hardInvalidReasons(reasons)
            .softScoreComponents(soft)
            .edgePenalties(penalties)
            .build();
    }

    private double xrefPenalty(ClauseNodeCandidate child) {
        return child.feature(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE) ? config.getEdgeXrefPenalty() : 0.0;
    }

    static void verifyEndpoints(List<ClauseNodeCandidate> nodes, List<ParentEdgeCandidate> edges) {
        Set<String> known = new HashSet<>();
        for (ClauseNodeCandidate node : nodes) {
            known.add(node.getNodeCandidateId());
        }
        for (ParentEdgeCandidate edge : edges) {
            if (!known.contains(edge.getChildCandidateId())) {
                throw new IllegalStateException("Edge references unknown child candidate: "
                    + edge.getChildCandidateId());
            }
            if (!edge.isRoot() && !known.contains(edge.getParentCandidateId())) {
                throw new IllegalStateException("Edge references unknown parent candidate: "
                    + edge.getParentCandidateId());
            }
        }
    }
}
