package im.arun.clausetree.solver;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.graph.CandidateGraphBuilder;
import im.arun.clausetree.model.AbstainedToken;
import im.arun.clausetree.model.CandidateGraph;
import im.arun.clausetree.model.LevelType;
import im.arun.clausetree.model.ParseStatus;
import im.arun.clausetree.model.ReasonCode;
import im.arun.clausetree.model.SolvedClauseNode;
import im.arun.clausetree.model.SolverSolution;
import im.arun.clausetree.util.ClauseTreeUtils;
import im.arun.clausetree.util.JsonSnapshots;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class CandidateGraphSolverTest {

    private static final String FLAT = "(a) First.\n(b) Second.\n(c) Third.\n";
    private static final String AMBIGUOUS_ROMAN =
        "(a) Parent clause.\n(i) Child one.\n(ii) Child two.\nsubject to clause (i) above.\n";
    private static final String NUMERIC_UNDER_ALPHA = "(a) Lead.\n(1) first\n(2) second\n(b) Next.\n";

    private final CandidateGraphBuilder graphBuilder = new CandidateGraphBuilder();
    private final CandidateGraphSolver solver = new CandidateGraphSolver();

    private SolverSolution solve(String text) {
        return solver.solve(graphBuilder.build(text), "sec-1");
    }

    @Nested
    @DisplayName("Clean structure")
    class CleanStructure {

        @Test
        @DisplayName("flat alpha list is accepted as three roots")
        void flat_list() {
            SolverSolution solution = solve(FLAT);

            assertThat(solution.getNodes())
                .extracting(SolvedClauseNode::getClauseId, SolvedClauseNode::getDepth, SolvedClauseNode::getParseStatus)
                .containsExactly(
                    tuple("a", 1, ParseStatus.ACCEPTED),
                    tuple("b", 1, ParseStatus.ACCEPTED),
                    tuple("c", 1, ParseStatus.ACCEPTED));
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.ACCEPTED);
            assertThat(solution.getSectionReasonCodes()).isEmpty();
            assertThat(solution.getAbstainedTokenIds()).isEmpty();
            assertThat(solution.getCriticalNodeAbstainRatio()).isZero();
            assertThat(solution.getSelectedParentEdges()).containsExactly(
                "edge_root__nc_tok_00001_0_alpha",
                "edge_root__nc_tok_00002_11_alpha",
                "edge_root__nc_tok_00003_23_alpha");
        }

        @Test
        @DisplayName("objective is node confidence plus edge scores")
        void objective() {
            SolverSolution solution = solve(FLAT);

            assertThat(solution.getObjectiveScore()).isCloseTo(9.9, within(1e-6));
            assertThat(solution.getObjectiveComponents()).containsOnly(
                entry("node_score_total", 2.1),
                entry("edge_soft_score_total", 7.8),
                entry("edge_penalty_total", 0.0),
                entry("edge_score_total", 7.8));
            assertThat(solution.getTop1Score()).isCloseTo(9.9, within(1e-6));
            assertThat(solution.getTop2Score()).isZero();
            assertThat(solution.getMarginRatio()).isCloseTo(1.0, within(1e-6));
            assertThat(solution.getTopKAlternatives()).hasSize(1);
        }

        @Test
        @DisplayName("numeric items attach under the preceding alpha clause")
        void nested_numeric() {
            SolverSolution solution = solve(NUMERIC_UNDER_ALPHA);

            assertThat(solution.getNodes())
                .extracting(SolvedClauseNode::getClauseId, SolvedClauseNode::getParentId,
                    SolvedClauseNode::getDepth, SolvedClauseNode::getLevelType)
                .containsExactly(
                    tuple("a", "", 1, LevelType.ALPHA),
                    tuple("a.1", "a", 2, LevelType.NUMERIC),
                    tuple("a.2", "a", 2, LevelType.NUMERIC),
                    tuple("b", "", 1, LevelType.ALPHA));
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.ACCEPTED);
            assertThat(solution.getSelectedParentEdges())
                .contains("edge_nc_tok_00001_0_alpha__nc_tok_00002_10_numeric");
        }

        @Test
        @DisplayName("repeated sibling labels get numeric suffixes")
        void duplicate_labels() {
            SolverSolution solution = solve("(a) One.\n(a) Again.\n");
            assertThat(solution.getNodes()).extracting(SolvedClauseNode::getClauseId).containsExactly("a", "a_2");
        }

        @Test
        @DisplayName("empty section is accepted with no nodes")
        void empty_section() {
            SolverSolution solution = solve("");
            assertThat(solution.getNodes()).isEmpty();
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.ACCEPTED);
            assertThat(solution.getObjectiveScore()).isZero();
        }
    }

    @Nested
    @DisplayName("Ambiguity")
    class Ambiguity {

        @Test
        @DisplayName("close alpha/roman readings abstain and the section abstains")
        void ambiguous_section_abstains() {
            SolverSolution solution = solve(AMBIGUOUS_ROMAN);

            assertThat(solution.getNodes()).extracting(SolvedClauseNode::getClauseId).containsExactly("a");
            assertThat(solution.getNodes().get(0).getParseStatus()).isEqualTo(ParseStatus.ACCEPTED);
            assertThat(solution.getAbstainedTokenIds())
                .containsExactly("tok_00002_19", "tok_00003_34", "tok_00004_68");
            assertThat(solution.getCriticalNodeAbstainRatio()).isEqualTo(0.75);
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.ABSTAIN);
            assertThat(solution.getSectionReasonCodes()).containsExactly(
                ReasonCode.INSUFFICIENT_CONTEXT, ReasonCode.LOW_MARGIN, ReasonCode.XREF_CONFLICT);
        }

        @Test
        @DisplayName("abstained tokens carry their candidates, margin and reasons")
        void abstained_token_detail() {
            SolverSolution solution = solve(AMBIGUOUS_ROMAN);

            AbstainedToken first = solution.getAbstainedTokens().get(0);
            assertThat(first.getTokenId()).isEqualTo("tok_00002_19");
            assertThat(first.getNodeCandidateIds())
                .containsExactly("nc_tok_00002_19_alpha", "nc_tok_00002_19_roman");
            assertThat(first.getReasonCodes())
                .containsExactly(ReasonCode.INSUFFICIENT_CONTEXT, ReasonCode.LOW_MARGIN);
            assertThat(first.getSolverMargin()).isCloseTo(0.07, within(1e-9));
            assertThat(first.getConfidenceScore()).isCloseTo(0.58, within(1e-9));

            AbstainedToken reference = solution.getAbstainedTokens().get(2);
            assertThat(reference.getReasonCodes()).containsExactly(
                ReasonCode.INSUFFICIENT_CONTEXT, ReasonCode.LOW_MARGIN, ReasonCode.XREF_CONFLICT);
            assertThat(reference.getConfidenceScore()).isCloseTo(0.18, within(1e-9));
        }

        @Test
        @DisplayName("global structure overrides a weak local preference and flags review")
        void structure_conflict() {
            ClauseTreeConfig config = new ClauseTreeConfig();
            config.setAbstainMarginThreshold(0.0);
            SolverSolution solution = new CandidateGraphSolver(config)
                .solve(new CandidateGraphBuilder(config).build("(a) Lead.\n(i) Sub.\n"), "sec-1");

            assertThat(solution.getNodes())
                .extracting(SolvedClauseNode::getClauseId, SolvedClauseNode::getLevelType)
                .containsExactly(tuple("a", LevelType.ALPHA), tuple("a.i", LevelType.ROMAN));
            SolvedClauseNode child = solution.getNodes().get(1);
            assertThat(child.getParseStatus()).isEqualTo(ParseStatus.REVIEW);
            assertThat(child.getReviewReasonCodes())
                .containsExactly(ReasonCode.LOW_MARGIN, ReasonCode.STRUCTURE_CONFLICT);
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.REVIEW);
            assertThat(solution.getSolverDiagnostics().get("warnings"))
                .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                .containsExactly("structure_conflict:tok_00002_10");
        }

        @Test
        @DisplayName("child of an abstained parent falls back to a selected ancestor and flags review")
        void parent_conflict() {
            SolverSolution solution = solve("(a) Lead.\n(i) Sub.\n(A) Deep.\n");

            assertThat(solution.getAbstainedTokenIds()).containsExactly("tok_00002_10");
            assertThat(solution.getNodes()).extracting(SolvedClauseNode::getClauseId).containsExactly("a", "a.A");
            SolvedClauseNode deep = solution.getNodes().get(1);
            assertThat(deep.getParentId()).isEqualTo("a");
            assertThat(deep.getParseStatus()).isEqualTo(ParseStatus.REVIEW);
            assertThat(deep.getReviewReasonCodes()).containsExactly(ReasonCode.PARENT_CONFLICT);
            assertThat(solution.getSectionParseStatus()).isEqualTo(ParseStatus.REVIEW);
            assertThat(solution.getSectionReasonCodes()).contains(ReasonCode.PARENT_CONFLICT);
            assertThat(solution.getSolverDiagnostics().get("warnings"))
                .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                .contains("parent_conflict:" + deep.getNodeCandidateId());
        }
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("small spaces are searched exhaustively")
        void exhaustive() {
            SolverSolution solution = solve(AMBIGUOUS_ROMAN);
            assertThat(solution.getSolverDiagnostics())
                .containsEntry("search_mode", TreeSearch.MODE_EXHAUSTIVE)
                .containsEntry("search_space", 8L)
                .containsEntry("search_truncated", false);
            assertThat(solution.getTopKAlternatives()).hasSize(5);
            assertThat(solution.getTopKAlternatives().get(0).getRank()).isEqualTo(1);
        }

        @Test
        @DisplayName("beam pruning marks the section as truncated")
        void beam_truncation() {
            ClauseTreeConfig config = new ClauseTreeConfig();
            config.setExhaustiveSearchLimit(1);
            config.setBeamWidth(1);
            SolverSolution solution = new CandidateGraphSolver(config)
                .solve(new CandidateGraphBuilder(config).build(AMBIGUOUS_ROMAN), "sec-1");

            assertThat(solution.getSolverDiagnostics())
                .containsEntry("search_mode", TreeSearch.MODE_BEAM)
                .containsEntry("search_truncated", true);
            assertThat(solution.getSectionReasonCodes()).contains(ReasonCode.SEARCH_TRUNCATED);
        }

        @Test
        @DisplayName("beam search over a long section stays fast and well formed")
        void long_section() {
            CandidateGraph graph = graphBuilder.build("(a) Lead.\n(i) Sub.\n".repeat(2000));

            SolverSolution solution = assertTimeout(Duration.ofSeconds(10), () -> {
                return solver.solve(graph, "sec-long");
            });

            assertThat(solution.getSolverDiagnostics())
                .containsEntry("input_tokens", 4000)
                .containsEntry("search_mode", TreeSearch.MODE_BEAM)
                .containsEntry("search_truncated", true);
            assertThat(solution.getNodes()).isNotEmpty();
            assertThat(ClauseTreeUtils.findViolations(solution.getNodes())).isEmpty();
        }

        @Test
        @DisplayName("diagnostics carry no timing values")
        void diagnostics_keys() {
            assertThat(solve(FLAT).getSolverDiagnostics()).containsOnlyKeys(
                "input_tokens", "input_node_candidates", "input_edge_candidates",
                "selected_nodes", "selected_edges", "search_mode", "search_space",
                "explored_states", "search_truncated", "warnings");
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("identical input serializes identically")
        void same_bytes() {
            JsonSnapshots snapshots = new JsonSnapshots();
            assertThat(snapshots.toJson(solve(AMBIGUOUS_ROMAN))).isEqualTo(snapshots.toJson(solve(AMBIGUOUS_ROMAN)));
        }

        @Test
        @DisplayName("parse run id depends on the section key and selection")
        void parse_run_id() {
            SolverSolution first = solve(FLAT);
            SolverSolution other = solver.solve(graphBuilder.build(FLAT), "sec-2");
            assertThat(first.getParseRunId()).startsWith("p2_").hasSize(19);
            assertThat(first.getParseRunId()).isEqualTo(solve(FLAT).getParseRunId());
            assertThat(other.getParseRunId()).isNotEqualTo(first.getParseRunId());
        }

        @Test
        @DisplayName("solved trees satisfy the structural checks")
        void well_formed() {
            for (String text : new String[] {FLAT, AMBIGUOUS_ROMAN, NUMERIC_UNDER_ALPHA}) {
                assertThat(ClauseTreeUtils.findViolations(solve(text).getNodes())).isEmpty();
            }
        }

        @Test
        @DisplayName("missing section key falls back to the default")
        void default_key() {
            assertThat(solver.solve(graphBuilder.build(FLAT)).getSectionKey())
                .isEqualTo(CandidateGraphSolver.DEFAULT_SECTION_KEY);
        }
    }
}
