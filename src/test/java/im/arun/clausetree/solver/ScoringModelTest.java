package im.arun.clausetree.solver;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.LevelType;
import im.arun.clausetree.model.ParentEdgeCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringModelTest {

    private final ScoringModel scoring = new ScoringModel(new ClauseTreeConfig());

    @Test
    @DisplayName("anchored line-start top-level candidate collects layout evidence")
    void layout_evidence() {
        assertThat(scoring.nodeScore(candidate(LevelType.ALPHA, true, true, 0.5, false, false)))
            .isEqualTo(0.75);
    }

    @Test
    @DisplayName("cross-reference context lowers the score")
    void xref_penalties() {
        assertThat(scoring.nodeScore(candidate(LevelType.ALPHA, true, true, 0.5, true, true)))
            .isEqualTo(0.43);
    }

    @Test
    @DisplayName("score never drops below zero")
    void clamped() {
        assertThat(scoring.nodeScore(candidate(LevelType.ROMAN, false, false, 0.0, true, true)))
            .isZero();
    }

    @Test
    @DisplayName("edge score is soft total minus penalties")
    void edge_score() {
        ParentEdgeCandidate edge = ParentEdgeCandidate.builder()
            .edgeId("edge_root__nc")
            .childCandidateId("nc")
            .root(true)
            .hardValid(true)
            .softScoreComponents(Map.of("a", 1.0, "b", 2.0))
            .edgePenalties(Map.of("xref_penalty", 0.35))
            .build();
        assertThat(scoring.edgeScore(edge)).isEqualTo(2.65);
    }

    private static ClauseNodeCandidate candidate(LevelType type, boolean anchor, boolean lineStart,
                                                 double indentation, boolean keyword, boolean preposition) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put(ClauseNodeCandidate.FEATURE_ANCHOR, anchor);
        features.put(ClauseNodeCandidate.FEATURE_LINE_START, lineStart);
        features.put(ClauseNodeCandidate.FEATURE_INDENTATION, indentation);
        features.put(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_PRE, keyword);
        features.put(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE, preposition);
        return ClauseNodeCandidate.builder()
            .nodeCandidateId("nc_tok_" + type.wireName())
            .tokenId("tok")
            .tokenIndex(0)
            .levelType(type)
            .ordinal(1)
            .depthHint(type.canonicalDepth())
            .spanStart(0)
            .spanEnd(3)
            .rawLabel("(x)")
            .normalizedLabel("x")
            .featureVector(features)
            .build();
    }
}
