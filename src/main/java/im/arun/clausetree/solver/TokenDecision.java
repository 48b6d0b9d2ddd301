package im.arun.clausetree.solver;

import im.arun.clausetree.model.ClauseNodeCandidate;
import im.arun.clausetree.model.ParseStatus;
import im.arun.clausetree.model.ReasonCode;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Local verdict for one token, taken from its candidates' node scores alone.
 */
@Value
class TokenDecision {
    String tokenId;
    int tokenIndex;
    /** Candidates ranked by local score (ties: shallower depth, then id). */
    List<ClauseNodeCandidate> ranked;
    Map<String, Double> localScores;
    ParseStatus status;
    List<ReasonCode> reasonCodes;
    double marginAbs;
    double confidenceScore;
    boolean ambiguous;
    boolean xrefConflict;

    ClauseNodeCandidate getPreferred() {
        return ranked.get(0);
    }

    boolean isAbstained() {
        return status == ParseStatus.ABSTAIN;
    }

    double localScore(ClauseNodeCandidate candidate) {
        return localScores.getOrDefault(candidate.getNodeCandidateId(), 0.0);
    }
}
