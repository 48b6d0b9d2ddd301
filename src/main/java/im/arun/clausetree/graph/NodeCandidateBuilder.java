package im.arun.clausetree.graph;

import im.arun.clausetree.lexer.EnumeratorLexer;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.LevelType;
import im.arun.clausetree.model.LexerToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Expands each token into one node candidate per level type it can be read as.
 */
public class NodeCandidateBuilder {
    private static final Logger logger = LoggerFactory.getLogger(NodeCandidateBuilder.class);

    static final Comparator<LexerToken> TOKEN_ORDER = Comparator
        .comparingInt(LexerToken::getPositionStart)
        .thenComparingInt(LexerToken::getPositionEnd)
        .thenComparing(LexerToken::getRawLabel)
        .thenComparing(LexerToken::getTokenId);

    static final Comparator<ClauseNodeCandidate> CANDIDATE_ORDER = Comparator
        .comparingInt(ClauseNodeCandidate::getSpanStart)
        .thenComparingInt(ClauseNodeCandidate::getSpanEnd)
        .thenComparingInt(ClauseNodeCandidate::getDepthHint)
        .thenComparing(ClauseNodeCandidate::getNodeCandidateId);

    public NodeBuildResult build(List<LexerToken> tokens) {
        List<LexerToken> ordered = new ArrayList<>(tokens);
        ordered.sort(TOKEN_ORDER);

        List<String> warnings = new ArrayList<>();
        TreeSet<String> ambiguous = new TreeSet<>();
        List<ClauseNodeCandidate> nodes = new ArrayList<>();

        for (int tokenIndex = 0; tokenIndex < ordered.size(); tokenIndex++) {
            LexerToken token = ordered.get(tokenIndex);
            if (token.isAmbiguous()) {
                ambiguous.add(token.getTokenId());
            }
            for (LevelType type : token.getCandidateTypes()) {
                Integer ordinal = token.getOrdinalByType().get(type);
                if (ordinal == null || ordinal <= 0) {
                    warnings.add("missing_ordinal:" + token.getTokenId() + ":" + type.wireName());
                    continue;
                }
                nodes.add(ClauseNodeCandidate.builder()
                    .nodeCandidateId("nc_" + token.getTokenId() + "_" + type.wireName())
                    .tokenId(token.getTokenId())
                    .tokenIndex(tokenIndex)
                    .levelType(type)
                    .ordinal(ordinal)
                    .depthHint(type.canonicalDepth())
                    .spanStart(token.getPositionStart())
                    .spanEnd(token.getPositionEnd())
                    .rawLabel(token.getRawLabel())
                    .normalizedLabel(token.getNormalizedLabel())
                    .featureVector(featureVector(token))
                    .build());
            }
        }

        nodes.sort(CANDIDATE_ORDER);
        if (!warnings.isEmpty()) {
            logger.warn("Node candidate construction produced {} warnings", warnings.size());
        }
        logger.debug("Built {} node candidates from {} tokens ({} ambiguous)",
            nodes.size(), ordered.size(), ambiguous.size());
        return new NodeBuildResult(List.copyOf(nodes), List.copyOf(ambiguous), List.copyOf(warnings));
    }

    private Map<String, Object> featureVector(LexerToken token) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put(ClauseNodeCandidate.FEATURE_ANCHOR,
            Boolean.TRUE.equals(token.getLayoutFeatures().get(EnumeratorLexer.LAYOUT_ANCHORED_BOUNDARY)));
        features.put(ClauseNodeCandidate.FEATURE_LINE_START, token.isLineStart());
        features.put(ClauseNodeCandidate.FEATURE_INDENTATION, token.getIndentationScore());
        features.put(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_PRE,
            token.xrefFeature(EnumeratorLexer.XREF_KEYWORD_PRE));
        features.put(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_POST,
            token.xrefFeature(EnumeratorLexer.XREF_KEYWORD_POST));
        features.put(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE,
            token.xrefFeature(EnumeratorLexer.XREF_PREPOSITION_PRE));
        return features;
    }
}
