package im.arun.clausetree.graph;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.lexer.EnumeratorLexer;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.LevelType;
import im.arun.clausetree.model.LexerToken;
import im.arun.clausetree.model.ParentEdgeCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class CandidateGraphBuilderTest {

    private static final String PARENT_AND_CHILD = "(a) Parent clause.\n(i) Child one.\n";

    private final CandidateGraphBuilder builder = new CandidateGraphBuilder();

    @Nested
    @DisplayName("Node candidates")
    class NodeCandidates {

        @Test
        @DisplayName("one candidate per reading, ordered by span then depth")
        void per_reading() {
            CandidateGraph graph = builder.build(PARENT_AND_CHILD);
            assertThat(graph.getNodeCandidates()).extracting(ClauseNodeCandidate::getNodeCandidateId)
                .containsExactly("nc_tok_00001_0_alpha", "nc_tok_00002_19_alpha", "nc_tok_00002_19_roman");
            assertThat(graph.getNodeCandidates()).extracting(ClauseNodeCandidate::getDepthHint)
                .containsExactly(1, 1, 2);
            assertThat(graph.getDiagnostics().getAmbiguousTokens()).containsExactly("tok_00002_19");
        }

        @Test
        @DisplayName("feature vector is copied from the token")
        void features() {
            ClauseNodeCandidate roman = builder.build(PARENT_AND_CHILD)
                .findCandidate("nc_tok_00002_19_roman").orElseThrow();
            assertThat(roman.getLevelType()).isEqualTo(LevelType.ROMAN);
            assertThat(roman.getOrdinal()).isEqualTo(1);
            assertThat(roman.feature(ClauseNodeCandidate.FEATURE_ANCHOR)).isTrue();
            assertThat(roman.feature(ClauseNodeCandidate.FEATURE_LINE_START)).isTrue();
            assertThat(roman.feature(ClauseNodeCandidate.FEATURE_XREF_KEYWORD_PRE)).isTrue();
            assertThat(roman.feature(ClauseNodeCandidate.FEATURE_XREF_PREPOSITION_PRE)).isFalse();
        }
    }

    @Nested
    @DisplayName("Parent edges")
    class ParentEdges {

        @Test
        @DisplayName("every candidate has a root edge and only hard-valid parents survive")
        void root_and_valid_edges() {
            CandidateGraph graph = builder.build(PARENT_AND_CHILD);
            List<String> edgeIds = graph.getParentEdgeCandidates().stream()
                .map(ParentEdgeCandidate::getEdgeId)
                .collect(Collectors.toList());
            assertThat(edgeIds).containsExactlyInAnyOrder(
                "edge_root__nc_tok_00001_0_alpha",
                "edge_root__nc_tok_00002_19_alpha",
                "edge_root__nc_tok_00002_19_roman",
                "edge_nc_tok_00001_0_alpha__nc_tok_00002_19_roman");
            assertThat(graph.getParentEdgeCandidates()).allMatch(ParentEdgeCandidate::isHardValid);
            assertThat(graph.getDiagnostics().getPrunedEdgesByReason()).containsOnly(
                entry(ParentEdgeBuilder.REASON_DEPTH, 1),
                entry(ParentEdgeBuilder.REASON_SAME_TOKEN, 1),
                entry(ParentEdgeBuilder.REASON_SPAN_ORDER, 1));
        }

        @Test
        @DisplayName("soft components and penalties for a one-level step")
        void edge_components() {
            ParentEdgeCandidate edge = edge(builder.build(PARENT_AND_CHILD),
                "edge_nc_tok_00001_0_alpha__nc_tok_00002_19_roman");
            assertThat(edge.getSoftScoreComponents()).containsOnly(
                entry(ParentEdgeBuilder.DEPTH_TRANSITION, 1.0),
                entry(ParentEdgeBuilder.ANCHOR_COMPATIBILITY, 1.0),
                entry(ParentEdgeBuilder.ORDINAL_PROXIMITY, 1.0));
            assertThat(edge.getPenaltyTotal()).isZero();

            ParentEdgeCandidate root = edge(builder.build(PARENT_AND_CHILD), "edge_root__nc_tok_00002_19_roman");
            assertThat(root.getSoftScoreTotal()).isCloseTo(2.2, within(1e-9));
            assertThat(root.getEdgePenalties()).containsEntry(ParentEdgeBuilder.DEPTH_PENALTY, 0.25);
        }

        @Test
        @DisplayName("invalid edges are kept with reasons when requested")
        void include_invalid() {
            ClauseTreeConfig config = new ClauseTreeConfig();
            config.setIncludeInvalidEdges(true);
            CandidateGraph graph = new CandidateGraphBuilder(config).build("(a) First.\n(b) Second.\n");

            ParentEdgeCandidate invalid = edge(graph, "edge_nc_tok_00001_0_alpha__nc_tok_00002_11_alpha");
            assertThat(invalid.isHardValid()).isFalse();
            assertThat(invalid.getHardInvalidReasons()).containsExactly(ParentEdgeBuilder.REASON_DEPTH);
            assertThat(graph.getDiagnostics().getPrunedEdgesByReason()).isEmpty();
        }

        @Test
        @DisplayName("same-depth siblings are pruned by default")
        void prune_siblings() {
            CandidateGraph graph = builder.build("(a) First.\n(b) Second.\n");
            assertThat(graph.getParentEdgeCandidates()).allMatch(ParentEdgeCandidate::isRoot);
            assertThat(graph.getDiagnostics().getPrunedEdgesByReason())
                .containsOnly(entry(ParentEdgeBuilder.REASON_DEPTH, 1));
        }

        @Test
        @DisplayName("parent scan stops at the per-child limit")
        void max_parents() {
            ParentEdgeBuilder edgeBuilder = new ParentEdgeBuilder(new ClauseTreeConfig());
            NodeBuildResult nodes = new NodeCandidateBuilder()
                .build(new EnumeratorLexer().lex("(a) x\n(b) y\n(1) z\n").getTokens());
            EdgeBuildResult limited = edgeBuilder.build(nodes.getNodes(), false, 1);
            assertThat(limited.getEdges()).extracting(ParentEdgeCandidate::getEdgeId)
                .contains("edge_nc_tok_00002_6_alpha__nc_tok_00003_12_numeric")
                .doesNotContain("edge_nc_tok_00001_0_alpha__nc_tok_00003_12_numeric");
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class Diagnostics {

        @Test
        @DisplayName("graph stats count tokens, candidates and edges")
        void stats() {
            CandidateGraph graph = builder.build(PARENT_AND_CHILD);
            assertThat(graph.getDiagnostics().getGraphStats()).containsOnly(
                entry("token_count", 2),
                entry("node_candidate_count", 3),
                entry("edge_candidate_count", 4),
                entry("root_edge_count", 3),
                entry("non_root_edge_count", 1),
                entry("ambiguous_token_count", 1));
        }

        @Test
        @DisplayName("deep candidate with no possible parent is reported")
        void orphan_warning() {
            CandidateGraph graph = builder.build("(i) Only.\n");
            assertThat(graph.getDiagnostics().getConstructionWarnings())
                .containsExactly("child_without_non_root_parent:nc_tok_00001_0_roman:depth=2");
        }

        @Test
        @DisplayName("reading without a usable ordinal is dropped with a warning")
        void missing_ordinal() {
            LexerToken lead = token("tok_00001_0", "(a)", 0, 0, List.of(LevelType.ALPHA), Map.of(LevelType.ALPHA, 1));
            LexerToken sub = token("tok_00002_10", "(i)", 10, 1,
                List.of(LevelType.ALPHA, LevelType.ROMAN), Map.of(LevelType.ALPHA, 0, LevelType.ROMAN, 1));

            CandidateGraph graph = builder.build(List.of(lead, sub));

            assertThat(graph.getNodeCandidates()).extracting(ClauseNodeCandidate::getNodeCandidateId)
                .containsExactly("nc_tok_00001_0_alpha", "nc_tok_00002_10_roman");
            assertThat(graph.getDiagnostics().getConstructionWarnings())
                .containsExactly("missing_ordinal:tok_00002_10:alpha");
            assertThat(edge(graph, "edge_nc_tok_00001_0_alpha__nc_tok_00002_10_roman").isHardValid()).isTrue();
        }

        @Test
        @DisplayName("edge to an unknown candidate is rejected")
        void unknown_endpoint() {
            List<ClauseNodeCandidate> nodes = builder.build(PARENT_AND_CHILD).getNodeCandidates();
            ParentEdgeCandidate dangling = ParentEdgeCandidate.builder()
                .edgeId("edge_nc_missing__nc_tok_00002_19_roman")
                .childCandidateId("nc_tok_00002_19_roman")
                .parentCandidateId("nc_missing")
                .hardValid(true)
                .build();

            assertThatThrownBy(() -> ParentEdgeBuilder.verifyEndpoints(nodes, List.of(dangling)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Edge references unknown parent candidate: nc_missing");
        }

        @Test
        @DisplayName("empty input gives an empty graph")
        void empty() {
            CandidateGraph graph = builder.build("");
            assertThat(graph.getNodeCandidates()).isEmpty();
            assertThat(graph.getParentEdgeCandidates()).isEmpty();
            assertThat(graph.getDiagnostics().getGraphStats()).containsEntry("token_count", 0);
        }
    }

    private static LexerToken token(String tokenId, String rawLabel, int start, int line,
                                    List<LevelType> types, Map<LevelType, Integer> ordinals) {
        return LexerToken.builder()
            .tokenId(tokenId)
            .rawLabel(rawLabel)
            .normalizedLabel(rawLabel.substring(1, rawLabel.length() - 1))
            .positionStart(start)
            .positionEnd(start + rawLabel.length())
            .lineIndex(line)
            .columnIndex(0)
            .lineStart(true)
            .indentationScore(0.0)
            .candidateTypes(types)
            .ordinalByType(ordinals)
            .layoutFeatures(Map.of(EnumeratorLexer.LAYOUT_ANCHORED_BOUNDARY, true))
            .build();
    }

    private static ParentEdgeCandidate edge(CandidateGraph graph, String edgeId) {
        return graph.getParentEdgeCandidates().stream()
            .filter(e -> e.getEdgeId().equals(edgeId))
            .findFirst()
            .orElseThrow();
    }
}
