package im.arun.clausetree.service;

import im.arun.clausetree.adapter.LegacyClauseAdapter;
import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.graph.CandidateGraphBuilder;
import im.arun.clausetree.lexer.EnumeratorLexer;
import im.arun.clausetree.lexer.LexResult;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.LinkContractPayload;
import im.arun.clausetree.model.NormalizedText;
import im.arun.clausetree.model.SolverSolution;
import im.arun.clausetree.solver.CandidateGraphSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the whole pipeline for one section:
 * normalize, lex, build the candidate graph, solve, adapt.
 * Instances hold no per-call state and can be shared across threads.
 */
public class ClauseTreeService {
    private static final Logger logger = LoggerFactory.getLogger(ClauseTreeService.class);

    private final EnumeratorLexer lexer;
    private final CandidateGraphBuilder graphBuilder;
    private final CandidateGraphSolver solver;
    private final LegacyClauseAdapter adapter;

    public ClauseTreeService() {
        this(new ClauseTreeConfig());
    }

    public ClauseTreeService(ClauseTreeConfig config) {
        this.lexer = new EnumeratorLexer(config);
        this.graphBuilder = new CandidateGraphBuilder(config);
        this.solver = new CandidateGraphSolver(config);
        this.adapter = new LegacyClauseAdapter(config);
    }

    public ParseResult parse(String text) {
        return parse(text, null, 0);
    }

    /**
     * @param sectionKey   caller's section identifier; defaults to {@code text::{length}}
     * @param globalOffset start of this section within its document, added to adapted spans
     */
    public ParseResult parse(String text, String sectionKey, int globalOffset) {
        String raw = text == null ? "" : text;
        String key = sectionKey == null || sectionKey.isEmpty() ? textKey(raw) : sectionKey;

        LexResult lexed = lexer.lex(raw);
        CandidateGraph graph = graphBuilder.build(lexed.getTokens());
        SolverSolution solution = solver.solve(graph, key);
        NormalizedText normalized = lexed.getNormalizedText();
        LinkContractPayload payload = adapter.buildPayload(solution, graph, normalized.getNormalizedText(), globalOffset);

        logger.debug("Parsed section {}: {} tokens, {} nodes", key, lexed.getTokens().size(), solution.getNodes().size());
        return new ParseResult(normalized, lexed.getTokens(), graph, solution, payload);
    }

    public ParseResult parse(String text, String sectionKey, int globalOffset, ParseCache cache) {
        if (cache == null) {
            return parse(text, sectionKey, globalOffset);
        }
        String cacheKey = ParseCache.buildKey(sectionKey, globalOffset, text);
        return cache.getOrCompute(cacheKey, () -> parse(text, sectionKey, globalOffset));
    }

    public SolverSolution solve(String text) {
        return solve(text, null);
    }

    public SolverSolution solve(String text, String sectionKey) {
        String raw = text == null ? "" : text;
        String key = sectionKey == null || sectionKey.isEmpty() ? textKey(raw) : sectionKey;
        return solver.solve(graphBuilder.build(raw), key);
    }

    public SolverSolution solve(NormalizedText normalized, String sectionKey) {
        String key = sectionKey == null || sectionKey.isEmpty()
            ? "normalized::" + normalized.getNormalizedText().length()
            : sectionKey;
        return solver.solve(graphBuilder.build(normalized), key);
    }

    public SolverSolution solve(List<LexerToken> tokens, String sectionKey) {
        return solver.solve(graphBuilder.build(tokens), sectionKey);
    }

    public SolverSolution solve(CandidateGraph graph, String sectionKey) {
        return solver.solve(graph, sectionKey);
    }

    private static String textKey(String raw) {
        return "text::" + raw.length();
    }
}
