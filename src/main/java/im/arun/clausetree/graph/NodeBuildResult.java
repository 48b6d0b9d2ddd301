package im.arun.clausetree.graph;

import im.arun.clausetree.model.ClauseNodeCandidate;
import lombok.Value;

import java.util.List;

@Value
public class NodeBuildResult {
    List<ClauseNodeCandidate> nodes;
    /** Sorted, distinct ids of tokens with more than one candidate type. */
    List<String> ambiguousTokenIds;
    List<String> warnings;
}
