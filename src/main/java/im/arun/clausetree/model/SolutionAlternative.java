package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * One explored full solution (every token assigned a candidate), ranked by objective.
 */
@Value
public class SolutionAlternative {

    @JsonProperty("rank")
    int rank;

    @JsonProperty("objective_score")
    double objectiveScore;

    @JsonProperty("node_candidate_ids")
    List<String> nodeCandidateIds;

    public SolutionAlternative(int rank, double objectiveScore, List<String> nodeCandidateIds) {
        this.rank = rank;
        this.objectiveScore = objectiveScore;
        this.nodeCandidateIds = List.copyOf(nodeCandidateIds);
    }
}
