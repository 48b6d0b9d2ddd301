package im.arun.clausetree.adapter;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.LegacyClauseNode;
import im.arun.clausetree.model.LinkContractPayload;
import im.arun.clausetree.model.ParseStatus;
import im.arun.clausetree.model.ReasonCode;
import im.arun.clausetree.model.SolvedClauseNode;
import im.arun.clausetree.model.SolverSolution;
import im.arun.clausetree.util.ClauseTreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a solver solution onto the legacy clause/link contract used by linking
 * and review tooling, keeping the legacy keys and adding the solver's status
 * fields.
 */
public class LegacyClauseAdapter {
    private static final Logger logger = LoggerFactory.getLogger(LegacyClauseAdapter.class);

    private final int headerTextChars;

    public LegacyClauseAdapter() {
        this(new ClauseTreeConfig());
    }

    public LegacyClauseAdapter(ClauseTreeConfig config) {
        this.headerTextChars = config.getHeaderTextChars();
    }

    /**
     * @param text         the text the solution's spans index into
     * @param globalOffset added to every span so positions are absolute within the document
     */
    public List<LegacyClauseNode> adapt(SolverSolution solution, CandidateGraph graph, String text, int globalOffset) {
        String source = text == null ? "" : text;
        List<SolvedClauseNode> ordered = new ArrayList<>(solution.getNodes());
        ordered.sort(Comparator.comparingInt(SolvedClauseNode::getSpanStart)
            .thenComparing(SolvedClauseNode::getClauseId));

        Map<String, List<SolvedClauseNode>> siblingsByParent = ClauseTreeUtils.groupByParent(ordered);
        Map<String, List<String>> childrenByParent = new HashMap<>();
        siblingsByParent.forEach((parent, siblings) -> {
            if (!parent.isEmpty()) {
                childrenByParent.put(parent, siblings.stream()
                    .map(SolvedClauseNode::getClauseId)
                    .sorted()
                    .collect(Collectors.toList()));
            }
        });

        List<LegacyClauseNode> rows = new ArrayList<>(ordered.size());
        for (SolvedClauseNode node : ordered) {
            Optional<ClauseNodeCandidate> candidate = graph.findCandidate(node.getNodeCandidateId());
            List<SolvedClauseNode> siblings = siblingsByParent.getOrDefault(node.getParentId(), List.of());

            int start = Math.max(0, node.getSpanStart() + globalOffset);
            int end = Math.max(start, node.getSpanEnd() + globalOffset);
            int headerStart = Math.min(source.length(), node.getSpanEnd());
            String header = source.substring(headerStart, Math.min(source.length(), headerStart + headerTextChars)).strip();

            rows.add(LegacyClauseNode.builder()
                .id(node.getClauseId())
                .label(candidate.map(ClauseNodeCandidate::getRawLabel)
                    .orElse("(" + ClauseTreeUtils.leafLabel(node.getClauseId()) + ")"))
                .depth(node.getDepth())
                .levelType(node.getLevelType() == null ? "" : node.getLevelType().wireName())
                .spanStart(start)
                .spanEnd(end)
                .headerText(header)
                .parentId(node.getParentId())
                .childrenIds(childrenByParent.getOrDefault(node.getClauseId(), List.of()))
                .anchorOk(candidate.map(c -> c.feature(ClauseNodeCandidate.FEATURE_ANCHOR)).orElse(false))
                .runLengthOk(siblings.size() >= 2)
                .gapOk(gapOk(node, siblings, graph))
                .indentationScore(round4(candidate
                    .map(c -> c.numericFeature(ClauseNodeCandidate.FEATURE_INDENTATION)).orElse(0.0)))
                .xrefSuspected(node.isXrefSuspected())
                .structuralCandidate(node.isStructuralCandidate())
                .parseConfidence(node.getConfidenceScore())
                .demotionReason(demotionReason(node))
                .parseStatus(node.getParseStatus().wireName())
                .abstainReasonCodes(wireNames(node.getAbstainReasonCodes()))
                .solverMargin(node.getSolverMargin())
                .build());
        }
        logger.debug("Adapted {} nodes for section {} at offset {}", rows.size(), solution.getSectionKey(), globalOffset);
        return rows;
    }

    public List<LegacyClauseNode> adapt(SolverSolution solution, CandidateGraph graph, String text) {
        return adapt(solution, graph, text, 0);
    }

    /**
     * Legacy nodes wrapped with section-level status for evidence and review transport.
     */
    public LinkContractPayload buildPayload(SolverSolution solution, CandidateGraph graph, String text,
                                           int globalOffset) {
        return LinkContractPayload.builder()
            .parseRunId(solution.getParseRunId())
            .parserVersion(solution.getParserVersion())
            .sectionKey(solution.getSectionKey())
            .sectionParseStatus(solution.getSectionParseStatus().wireName())
            .sectionReasonCodes(wireNames(solution.getSectionReasonCodes()))
            .criticalNodeAbstainRatio(solution.getCriticalNodeAbstainRatio())
            .abstainedTokenIds(solution.getAbstainedTokenIds())
            .nodes(adapt(solution, graph, text, globalOffset))
            .build();
    }

    /**
     * True when the node continues its previous sibling's sequence without a
     * skipped ordinal; the first sibling always passes.
     */
    private static boolean gapOk(SolvedClauseNode node, List<SolvedClauseNode> siblings, CandidateGraph graph) {
        int index = siblings.indexOf(node);
        if (index <= 0) {
            return true;
        }
        SolvedClauseNode previous = siblings.get(index - 1);
        Optional<ClauseNodeCandidate> current = graph.findCandidate(node.getNodeCandidateId());
        Optional<ClauseNodeCandidate> prior = graph.findCandidate(previous.getNodeCandidateId());
        if (current.isEmpty() || prior.isEmpty()) {
            return true;
        }
        return current.get().getLevelType() == prior.get().getLevelType()
            && current.get().getOrdinal() == prior.get().getOrdinal() + 1;
    }

    private static String demotionReason(SolvedClauseNode node) {
        if (node.getParseStatus() == ParseStatus.ABSTAIN) {
            return String.join("; ", wireNames(node.getAbstainReasonCodes()));
        }
        if (node.getParseStatus() == ParseStatus.REVIEW) {
            return String.join("; ", wireNames(node.getReviewReasonCodes()));
        }
        return "";
    }

    private static List<String> wireNames(List<ReasonCode> codes) {
        return codes.stream().map(ReasonCode::wireName).collect(Collectors.toList());
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
