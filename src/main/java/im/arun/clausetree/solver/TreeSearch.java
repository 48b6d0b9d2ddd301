package im.arun.clausetree.solver;

import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParentEdgeCandidate;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Searches full solutions: one candidate per token, each attached to its best
 * hard-valid edge whose parent belongs to the same solution.
 * <p>
 * Tokens are expanded in order. A hard-valid parent always starts strictly
 * before its child, so it belongs to an already expanded token and partial
 * scores never change once computed. Small assignment spaces are enumerated
 * exhaustively; larger ones fall back to a beam that reports truncation.
 */
class TreeSearch {
    private static final Logger logger = LoggerFactory.getLogger(TreeSearch.class);

    static final String MODE_EXHAUSTIVE = "exhaustive";
    static final String MODE_BEAM = "beam";

    private final ScoringModel scoring;
    private final int exhaustiveLimit;
    private final int beamWidth;
    private final int topK;

    TreeSearch(ScoringModel scoring, int exhaustiveLimit, int beamWidth, int topK) {
        if (beamWidth < 1 || topK < 1) {
            throw new IllegalArgumentException("beam width and top-k must be >= 1");
        }
        this.scoring = scoring;
        this.exhaustiveLimit = exhaustiveLimit;
        this.beamWidth = beamWidth;
        this.topK = topK;
    }

    /**
     * @param groups       candidates per token, in token order
     * @param edgesByChild hard-valid edges keyed by child candidate id
     */
    SearchResult search(List<List<ClauseNodeCandidate>> groups,
                        Map<String, List<ParentEdgeCandidate>> edgesByChild) {
        Map<String, Integer> groupById = new HashMap<>();
        for (int g = 0; g < groups.size(); g++) {
            for (ClauseNodeCandidate candidate : groups.get(g)) {
                groupById.put(candidate.getNodeCandidateId(), g);
            }
        }
        int[] earliestParentGroup = earliestParentGroups(groups, edgesByChild, groupById);

        long space = assignmentSpace(groups);
        boolean exhaustive = space <= exhaustiveLimit;
        String mode = exhaustive ? MODE_EXHAUSTIVE : MODE_BEAM;

        List<State> frontier = new ArrayList<>();
        frontier.add(State.INITIAL);
        long explored = 0;
        boolean truncated = false;

        for (int g = 0; g < groups.size(); g++) {
            List<ClauseNodeCandidate> group = groups.get(g);
            List<State> next = new ArrayList<>(frontier.size() * group.size());
            for (State state : frontier) {
                Set<String> chosenParents = state.chosenSince(earliestParentGroup[g]);
                for (ClauseNodeCandidate candidate : group) {
                    ParentEdgeCandidate edge = bestEdge(candidate, chosenParents, edgesByChild);
                    next.add(state.extend(g, candidate, edge,
                        scoring.nodeScore(candidate) + scoring.edgeScore(edge)));
                    explored++;
                }
            }
            next.sort(State.RANKING);
            if (!exhaustive && next.size() > beamWidth) {
                truncated = true;
                next = new ArrayList<>(next.subList(0, beamWidth));
            }
            frontier = next;
        }

        int keep = Math.max(topK, 2);
        List<FullSolution> ranked = new ArrayList<>();
        for (State state : frontier.subList(0, Math.min(keep, frontier.size()))) {
            ranked.add(toSolution(state, groups.size()));
        }
        logger.debug("Tree search mode={} space={} explored={} truncated={}", mode, space, explored, truncated);
        return new SearchResult(Collections.unmodifiableList(ranked), mode, explored, truncated, space);
    }

    /**
     * Earliest token position holding a possible parent of any candidate in each group,
     * or the group itself when none of its candidates has a non-root edge.
     */
    private static int[] earliestParentGroups(List<List<ClauseNodeCandidate>> groups,
                                              Map<String, List<ParentEdgeCandidate>> edgesByChild,
                                              Map<String, Integer> groupById) {
        int[] earliest = new int[groups.size()];
        for (int g = 0; g < groups.size(); g++) {
            int min = g;
            for (ClauseNodeCandidate candidate : groups.get(g)) {
                for (ParentEdgeCandidate edge : edgesByChild.getOrDefault(candidate.getNodeCandidateId(), List.of())) {
                    Integer parentGroup = edge.isRoot() ? null : groupById.get(edge.getParentCandidateId());
                    if (parentGroup != null && parentGroup < min) {
                        min = parentGroup;
                    }
                }
            }
            earliest[g] = min;
        }
        return earliest;
    }

    /**
     * Best hard-valid edge whose parent is the root or one of {@code chosenParents}.
     * Ties prefer the higher score, then a non-root parent, then the edge id.
     */
    private ParentEdgeCandidate bestEdge(ClauseNodeCandidate candidate, Set<String> chosenParents,
                                         Map<String, List<ParentEdgeCandidate>> edgesByChild) {
        ParentEdgeCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ParentEdgeCandidate edge : edgesByChild.getOrDefault(candidate.getNodeCandidateId(), List.of())) {
            if (!edge.isRoot() && !chosenParents.contains(edge.getParentCandidateId())) {
                continue;
            }
            double score = scoring.edgeScore(edge);
            if (best == null || EdgePreference.better(edge, score, best, bestScore)) {
                best = edge;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No root edge for candidate " + candidate.getNodeCandidateId());
        }
        return best;
    }

    private static long assignmentSpace(List<List<ClauseNodeCandidate>> groups) {
        long space = 1;
        for (List<ClauseNodeCandidate> group : groups) {
            space *= Math.max(1, group.size());
            if (space > Integer.MAX_VALUE) {
                return Long.MAX_VALUE;
            }
        }
        return space;
    }

    private static FullSolution toSolution(State state, int size) {
        ClauseNodeCandidate[] candidates = new ClauseNodeCandidate[size];
        ParentEdgeCandidate[] edges = new ParentEdgeCandidate[size];
        for (State s = state; s.candidate != null; s = s.previous) {
            candidates[s.group] = s.candidate;
            edges[s.group] = s.edge;
        }
        Map<String, ParentEdgeCandidate> edgeByChild = new LinkedHashMap<>();
        for (int g = 0; g < size; g++) {
            edgeByChild.put(candidates[g].getNodeCandidateId(), edges[g]);
        }
        return new FullSolution(List.of(candidates), Collections.unmodifiableMap(edgeByChild),
            ScoringModel.round6(state.score));
    }

    /**
     * Edge tie-break shared with the final edge selection.
     */
    static final class EdgePreference {
        private EdgePreference() {
        }

        static boolean better(ParentEdgeCandidate edge, double score, ParentEdgeCandidate best, double bestScore) {
            if (score != bestScore) {
                return score > bestScore;
            }
            if (edge.isRoot() != best.isRoot()) {
                return !edge.isRoot();
            }
            return edge.getEdgeId().compareTo(best.getEdgeId()) < 0;
        }
    }

    @Value
    static class FullSolution {
        List<ClauseNodeCandidate> assignment;
        Map<String, ParentEdgeCandidate> edgeByChild;
        double score;

        ClauseNodeCandidate candidateAt(int tokenPosition) {
            return assignment.get(tokenPosition);
        }
    }

    @Value
    static class SearchResult {
        /** Best first, at most max(top-k, 2) entries. */
        List<FullSolution> ranked;
        String mode;
        long exploredStates;
        boolean truncated;
        long assignmentSpace;

        FullSolution best() {
            return ranked.isEmpty() ? null : ranked.get(0);
        }
    }

    /**
     * Partial solution as a chain back to the empty state. Extending shares the
     * prefix, so siblings in the frontier reuse their common history.
     */
    private static final class State {
        static final State INITIAL = new State(null, -1, null, null, 0.0);

        static final Comparator<State> RANKING = Comparator
            .comparingDouble((State s) -> -s.rankScore)
            .thenComparing(State::compareChoices);

        final State previous;
        final int group;
        final ClauseNodeCandidate candidate;
        final ParentEdgeCandidate edge;
        final double score;
        final double rankScore;

        private State(State previous, int group, ClauseNodeCandidate candidate,
                      ParentEdgeCandidate edge, double score) {
            this.previous = previous;
            this.group = group;
            this.candidate = candidate;
            this.edge = edge;
            this.score = score;
            this.rankScore = ScoringModel.round6(score);
        }

        State extend(int nextGroup, ClauseNodeCandidate chosen, ParentEdgeCandidate chosenEdge, double delta) {
            return new State(this, nextGroup, chosen, chosenEdge, score + delta);
        }

        /**
         * Candidate ids chosen at token positions {@code >= fromGroup}.
         */
        Set<String> chosenSince(int fromGroup) {
            if (group < fromGroup) {
                return Set.of();
            }
            Set<String> chosen = new HashSet<>();
            for (State s = this; s.candidate != null && s.group >= fromGroup; s = s.previous) {
                chosen.add(s.candidate.getNodeCandidateId());
            }
            return chosen;
        }

        /**
         * Orders equal-score states by candidate ids in token order. Both states
         * cover the same token positions, so the walk stops at their shared prefix.
         */
        private static int compareChoices(State a, State b) {
            int result = 0;
            while (a != b) {
                int cmp = a.candidate.getNodeCandidateId().compareTo(b.candidate.getNodeCandidateId());
                if (cmp != 0) {
                    result = cmp;
                }
                a = a.previous;
                b = b.previous;
            }
            return result;
        }
    }
}
