package im.arun.clausetree.solver;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.AbstainedToken;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParentEdgeCandidate;
import im.arun.clausetree.model.ParseStatus;
import im.arun.clausetree.model.ReasonCode;
import im.arun.clausetree.model.SolutionAlternative;
import im.arun.clausetree.model.SolvedClauseNode;
import im.arun.clausetree.model.SolverSolution;
import im.arun.clausetree.util.ClauseTreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selects one interpretation per token and one parent per selected node, and
 * grades the result as accepted, review or abstain.
 * <p>
 * Low confidence never fails a solve: every call returns a complete
 * {@link SolverSolution} whose statuses and reason codes say how far the
 * structure can be trusted.
 */
public class CandidateGraphSolver {
    private static final Logger logger = LoggerFactory.getLogger(CandidateGraphSolver.class);

    public static final String DEFAULT_SECTION_KEY = "section::unknown";

    private static final Comparator<ClauseNodeCandidate> SELECTION_ORDER = Comparator
        .comparingInt(ClauseNodeCandidate::getSpanStart)
        .thenComparingInt(ClauseNodeCandidate::getSpanEnd)
        .thenComparingInt(ClauseNodeCandidate::getDepthHint)
        .thenComparing(ClauseNodeCandidate::getNodeCandidateId);

    private static final Comparator<ClauseNodeCandidate> SIBLING_ORDER = Comparator
        .comparingInt(ClauseNodeCandidate::getSpanStart)
        .thenComparing(ClauseNodeCandidate::getNodeCandidateId);

    private final ClauseTreeConfig config;
    private final ScoringModel scoring;
    private final TokenDecider decider;
    private final TreeSearch treeSearch;

    public CandidateGraphSolver() {
        this(new ClauseTreeConfig());
    }

    public CandidateGraphSolver(ClauseTreeConfig config) {
        this.config = config;
        this.scoring = new ScoringModel(config);
        this.decider = new TokenDecider(config, scoring);
        this.treeSearch = new TreeSearch(scoring, config.getExhaustiveSearchLimit(),
            config.getBeamWidth(), config.getTopK());
    }

    public SolverSolution solve(CandidateGraph graph) {
        return solve(graph, DEFAULT_SECTION_KEY);
    }

    public SolverSolution solve(CandidateGraph graph, String sectionKey) {
        long started = System.nanoTime();
        String key = sectionKey == null || sectionKey.isEmpty() ? DEFAULT_SECTION_KEY : sectionKey;

        List<TokenDecision> decisions = decider.decide(graph);
        Map<String, List<ParentEdgeCandidate>> edgesByChild = hardValidEdgesByChild(graph);

        List<List<ClauseNodeCandidate>> groups = new ArrayList<>(decisions.size());
        for (TokenDecision decision : decisions) {
            groups.add(decision.getRanked());
        }
        TreeSearch.SearchResult search = treeSearch.search(groups, edgesByChild);
        TreeSearch.FullSolution best = search.best();

        Set<String> warnings = new TreeSet<>();
        List<AbstainedToken> abstained = new ArrayList<>();
        Map<String, Verdict> verdicts = new LinkedHashMap<>();
        for (int i = 0; i < decisions.size(); i++) {
            TokenDecision decision = decisions.get(i);
            if (decision.isAbstained()) {
                abstained.add(toAbstainedToken(decision));
                if (decision.isAmbiguous()) {
                    warnings.add("ambiguous_abstain:" + decision.getTokenId());
                }
                continue;
            }
            ClauseNodeCandidate chosen = best.candidateAt(i);
            Verdict verdict = new Verdict(decision, chosen);
            if (!chosen.getNodeCandidateId().equals(decision.getPreferred().getNodeCandidateId())) {
                verdict.flag(ReasonCode.STRUCTURE_CONFLICT);
                warnings.add("structure_conflict:" + decision.getTokenId());
            }
            verdicts.put(chosen.getNodeCandidateId(), verdict);
        }

        Map<String, ClauseNodeCandidate> selected = new LinkedHashMap<>();
        verdicts.values().stream()
            .map(v -> v.candidate)
            .sorted(SELECTION_ORDER)
            .forEach(c -> selected.put(c.getNodeCandidateId(), c));

        List<ParentEdgeCandidate> chosenEdges = new ArrayList<>(selected.size());
        boolean parentConflict = false;
        for (ClauseNodeCandidate child : selected.values()) {
            chosenEdges.add(selectEdge(child, selected.keySet(), edgesByChild));
            ParentEdgeCandidate searched = best.getEdgeByChild().get(child.getNodeCandidateId());
            if (searched != null && !searched.isRoot() && !selected.containsKey(searched.getParentCandidateId())) {
                verdicts.get(child.getNodeCandidateId()).flag(ReasonCode.PARENT_CONFLICT);
                warnings.add("parent_conflict:" + child.getNodeCandidateId());
                parentConflict = true;
            }
        }

        List<SolvedClauseNode> nodes = buildNodes(selected, chosenEdges, verdicts);
        List<String> violations = ClauseTreeUtils.findViolations(nodes);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Solved tree is malformed: " + violations);
        }

        int criticalTokens = decisions.size();
        long criticalAbstained = decisions.stream()
            .filter(d -> d.isAbstained() && d.isAmbiguous())
            .count();
        double ratio = criticalTokens == 0 ? 0.0 : ScoringModel.round6((double) criticalAbstained / criticalTokens);

        EnumSet<ReasonCode> sectionReasons = EnumSet.noneOf(ReasonCode.class);
        abstained.forEach(t -> sectionReasons.addAll(t.getReasonCodes()));
        nodes.forEach(n -> sectionReasons.addAll(n.getReviewReasonCodes()));
        if (parentConflict) {
            sectionReasons.add(ReasonCode.PARENT_CONFLICT);
        }
        if (search.isTruncated()) {
            sectionReasons.add(ReasonCode.SEARCH_TRUNCATED);
            warnings.add("search_truncated");
        }

        ParseStatus sectionStatus;
        if (criticalAbstained > 0 && ratio >= config.getSectionAbstainRatioThreshold()) {
            sectionStatus = ParseStatus.ABSTAIN;
            sectionReasons.add(ReasonCode.INSUFFICIENT_CONTEXT);
        } else if (ratio > config.getSectionReviewRatioThreshold()
            || !abstained.isEmpty()
            || parentConflict
            || search.isTruncated()
            || nodes.stream().anyMatch(n -> n.getParseStatus() == ParseStatus.REVIEW)) {
            sectionStatus = ParseStatus.REVIEW;
        } else {
            sectionStatus = ParseStatus.ACCEPTED;
        }

        double nodeTotal = 0.0;
        for (SolvedClauseNode node : nodes) {
            nodeTotal += node.getConfidenceScore();
        }
        double softTotal = 0.0;
        double penaltyTotal = 0.0;
        double edgeTotal = 0.0;
        for (ParentEdgeCandidate edge : chosenEdges) {
            softTotal += edge.getSoftScoreTotal();
            penaltyTotal += edge.getPenaltyTotal();
            edgeTotal += scoring.edgeScore(edge);
        }
        Map<String, Double> components = new LinkedHashMap<>();
        components.put("node_score_total", ScoringModel.round6(nodeTotal));
        components.put("edge_soft_score_total", ScoringModel.round6(softTotal));
        components.put("edge_penalty_total", ScoringModel.round6(penaltyTotal));
        components.put("edge_score_total", ScoringModel.round6(edgeTotal));

        double top1 = best.getScore();
        double top2 = search.getRanked().size() > 1 ? search.getRanked().get(1).getScore() : 0.0;
        double marginAbs = ScoringModel.round6(Math.max(0.0, top1 - top2));
        double marginRatio = ScoringModel.round6(marginAbs / Math.max(top1, 1e-9));

        List<String> selectedIds = selected.keySet().stream().sorted().toList();
        List<String> abstainedIds = abstained.stream().map(AbstainedToken::getTokenId).sorted().toList();

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("input_tokens", decisions.size());
        diagnostics.put("input_node_candidates", graph.getNodeCandidates().size());
        diagnostics.put("input_edge_candidates", graph.getParentEdgeCandidates().size());
        diagnostics.put("selected_nodes", selectedIds.size());
        diagnostics.put("selected_edges", chosenEdges.size());
        diagnostics.put("search_mode", search.getMode());
        diagnostics.put("search_space", search.getAssignmentSpace());
        diagnostics.put("explored_states", search.getExploredStates());
        diagnostics.put("search_truncated", search.isTruncated());
        diagnostics.put("warnings", List.copyOf(warnings));

        SolverSolution solution = SolverSolution.builder()
            .parseRunId(parseRunId(key, selectedIds, abstainedIds))
            .parserVersion(config.getParserVersion())
            .sectionKey(key)
            .selectedNodeCandidates(selectedIds)
            .selectedParentEdges(chosenEdges.stream().map(ParentEdgeCandidate::getEdgeId).sorted().toList())
            .abstainedTokenIds(abstainedIds)
            .abstainedTokens(abstained)
            .objectiveScore(ScoringModel.round6(nodeTotal + edgeTotal))
            .objectiveComponents(components)
            .topKAlternatives(alternatives(search))
            .solverDiagnostics(diagnostics)
            .nodes(nodes)
            .sectionParseStatus(sectionStatus)
            .sectionReasonCodes(new ArrayList<>(sectionReasons))
            .criticalNodeAbstainRatio(ratio)
            .top1Score(top1)
            .top2Score(top2)
            .marginAbs(marginAbs)
            .marginRatio(marginRatio)
            .build();

        logger.info("Solved section {}: status={} nodes={} abstained={} ratio={} in {} ms",
            key, sectionStatus, nodes.size(), abstainedIds.size(), ratio,
            (System.nanoTime() - started) / 1_000_000);
        return solution;
    }

    private static Map<String, List<ParentEdgeCandidate>> hardValidEdgesByChild(CandidateGraph graph) {
        Map<String, List<ParentEdgeCandidate>> byChild = new HashMap<>();
        for (ParentEdgeCandidate edge : graph.getParentEdgeCandidates()) {
            if (edge.isHardValid()) {
                byChild.computeIfAbsent(edge.getChildCandidateId(), k -> new ArrayList<>()).add(edge);
            }
        }
        return byChild;
    }

    private ParentEdgeCandidate selectEdge(ClauseNodeCandidate child, Set<String> selectedIds,
                                           Map<String, List<ParentEdgeCandidate>> edgesByChild) {
        ParentEdgeCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ParentEdgeCandidate edge : edgesByChild.getOrDefault(child.getNodeCandidateId(), List.of())) {
            if (!edge.isRoot() && !selectedIds.contains(edge.getParentCandidateId())) {
                continue;
            }
            double score = scoring.edgeScore(edge);
            if (best == null || TreeSearch.EdgePreference.better(edge, score, best, bestScore)) {
                best = edge;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No root edge for candidate " + child.getNodeCandidateId());
        }
        return best;
    }

    private List<SolvedClauseNode> buildNodes(Map<String, ClauseNodeCandidate> selected,
                                              List<ParentEdgeCandidate> edges,
                                              Map<String, Verdict> verdicts) {
        List<ClauseNodeCandidate> rootChildren = new ArrayList<>();
        Map<String, List<ClauseNodeCandidate>> childrenByParent = new HashMap<>();
        for (ParentEdgeCandidate edge : edges) {
            ClauseNodeCandidate child = selected.get(edge.getChildCandidateId());
            if (edge.isRoot()) {
                rootChildren.add(child);
            } else {
                childrenByParent.computeIfAbsent(edge.getParentCandidateId(), k -> new ArrayList<>()).add(child);
            }
        }
        rootChildren.sort(SIBLING_ORDER);
        childrenByParent.values().forEach(children -> children.sort(SIBLING_ORDER));

        List<SolvedClauseNode> out = new ArrayList<>(selected.size());
        Map<String, Map<String, Integer>> labelCounts = new HashMap<>();
        for (ClauseNodeCandidate child : rootChildren) {
            emit(child, "", 1, childrenByParent, verdicts, labelCounts, out);
        }
        out.sort(Comparator.comparingInt(SolvedClauseNode::getSpanStart).thenComparing(SolvedClauseNode::getClauseId));
        return out;
    }

    private void emit(ClauseNodeCandidate candidate, String parentClauseId, int depth,
                      Map<String, List<ClauseNodeCandidate>> childrenByParent,
                      Map<String, Verdict> verdicts,
                      Map<String, Map<String, Integer>> labelCounts,
                      List<SolvedClauseNode> out) {
        Map<String, Integer> siblings = labelCounts.computeIfAbsent(parentClauseId, k -> new HashMap<>());
        String base = candidate.getNormalizedLabel();
        int occurrence = siblings.merge(base, 1, Integer::sum);
        String segment = occurrence == 1 ? base : base + "_" + occurrence;
        String clauseId = parentClauseId.isEmpty() ? segment : parentClauseId + "." + segment;

        Verdict verdict = verdicts.get(candidate.getNodeCandidateId());
        out.add(SolvedClauseNode.builder()
            .nodeCandidateId(candidate.getNodeCandidateId())
            .clauseId(clauseId)
            .parentId(parentClauseId)
            .depth(depth)
            .levelType(candidate.getLevelType())
            .spanStart(candidate.getSpanStart())
            .spanEnd(candidate.getSpanEnd())
            .structuralCandidate(true)
            .xrefSuspected(candidate.feature(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_PRE)
                || candidate.feature(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE))
            .parseStatus(verdict.status)
            .reviewReasonCodes(verdict.status == ParseStatus.REVIEW ? new ArrayList<>(verdict.reasons) : List.of())
            .solverMargin(verdict.decision.getMarginAbs())
            .confidenceScore(verdict.decision.localScore(candidate))
            .build());

        for (ClauseNodeCandidate child : childrenByParent.getOrDefault(candidate.getNodeCandidateId(), List.of())) {
            emit(child, clauseId, depth + 1, childrenByParent, verdicts, labelCounts, out);
        }
    }

    private static AbstainedToken toAbstainedToken(TokenDecision decision) {
        List<String> candidateIds = decision.getRanked().stream()
            .map(ClauseNodeCandidate::getNodeCandidateId)
            .sorted()
            .toList();
        return new AbstainedToken(decision.getTokenId(), candidateIds, decision.getReasonCodes(),
            decision.getMarginAbs(), decision.getConfidenceScore());
    }

    private List<SolutionAlternative> alternatives(TreeSearch.SearchResult search) {
        List<SolutionAlternative> out = new ArrayList<>();
        List<TreeSearch.FullSolution> ranked = search.getRanked();
        for (int i = 0; i < Math.min(config.getTopK(), ranked.size()); i++) {
            TreeSearch.FullSolution solution = ranked.get(i);
            List<String> ids = solution.getAssignment().stream()
                .map(ClauseNodeCandidate::getNodeCandidateId)
                .toList();
            out.add(new SolutionAlternative(i + 1, solution.getScore(), ids));
        }
        return out;
    }

    /**
     * {@code p2_} plus the first 16 hex chars of SHA-1 over the section key,
     * the sorted selected candidate ids and the sorted abstained token ids.
     */
    static String parseRunId(String sectionKey, List<String> selectedIds, List<String> abstainedIds) {
        List<String> parts = new ArrayList<>(1 + selectedIds.size() + abstainedIds.size());
        parts.add(sectionKey);
        parts.addAll(selectedIds.stream().sorted().toList());
        parts.addAll(abstainedIds.stream().sorted().toList());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
            return "p2_" + HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Mutable status of one selected node while conflicts are being collected.
     */
    private static final class Verdict {
        final TokenDecision decision;
        final ClauseNodeCandidate candidate;
        final Set<ReasonCode> reasons = new HashSet<>();
        ParseStatus status;

        Verdict(TokenDecision decision, ClauseNodeCandidate candidate) {
            this.decision = decision;
            this.candidate = candidate;
            this.status = decision.getStatus();
            this.reasons.addAll(decision.getReasonCodes());
        }

        void flag(ReasonCode reason) {
            reasons.add(reason);
            status = ParseStatus.REVIEW;
        }
    }
}
