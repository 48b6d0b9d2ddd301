package im.arun.clausetree.graph;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.lexer.EnumeratorLexer;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.GraphBuildDiagnostics;
import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.NormalizedText;
import im.arun.clausetree.model.ParentEdgeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the candidate graph for one section from raw text, normalized text
 * or an already lexed token stream.
 */
public class CandidateGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CandidateGraphBuilder.class);

    private final EnumeratorLexer lexer;
    private final NodeCandidateBuilder nodeBuilder;
    private final ParentEdgeBuilder edgeBuilder;

    public CandidateGraphBuilder() {
        this(new ClauseTreeConfig());
    }

    public CandidateGraphBuilder(ClauseTreeConfig config) {
        this(new EnumeratorLexer(config), new NodeCandidateBuilder(), new ParentEdgeBuilder(config));
    }

    public CandidateGraphBuilder(EnumeratorLexer lexer, NodeCandidateBuilder nodeBuilder,
                                 ParentEdgeBuilder edgeBuilder) {
        this.lexer = lexer;
        this.nodeBuilder = nodeBuilder;
        this.edgeBuilder = edgeBuilder;
    }

    public CandidateGraph build(String rawText) {
        return build(lexer.lex(rawText).getTokens());
    }

    public CandidateGraph build(NormalizedText normalized) {
        return build(lexer.lex(normalized).getTokens());
    }

    public CandidateGraph build(List<LexerToken> tokens) {
        NodeBuildResult nodes = nodeBuilder.build(tokens);
        EdgeBuildResult edges = edgeBuilder.build(nodes.getNodes());

        int rootEdges = 0;
        for (ParentEdgeCandidate edge : edges.getEdges()) {
            if (edge.isRoot()) {
                rootEdges++;
            }
        }

        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("token_count", tokens.size());
        stats.put("node_candidate_count", nodes.getNodes().size());
        stats.put("edge_candidate_count", edges.getEdges().size());
        stats.put("root_edge_count", rootEdges);
        stats.put("non_root_edge_count", edges.getEdges().size() - rootEdges);
        stats.put("ambiguous_token_count", nodes.getAmbiguousTokenIds().size());

        List<String> warnings = new ArrayList<>(nodes.getWarnings());
        warnings.addAll(edges.getWarnings());

        GraphBuildDiagnostics diagnostics = new GraphBuildDiagnostics(
            stats, edges.getPrunedReasonCounts(), nodes.getAmbiguousTokenIds(), warnings);
        for (String warning : diagnostics.getConstructionWarnings()) {
            logger.warn("Graph construction warning: {}", warning);
        }
        logger.debug("Candidate graph stats: {}", diagnostics.getGraphStats());
        return new CandidateGraph(nodes.getNodes(), edges.getEdges(), diagnostics);
    }
}
