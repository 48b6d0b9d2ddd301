package im.arun.clausetree.graph;

import im.arun.clausetree.model.ParentEdgeCandidate;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class EdgeBuildResult {
    List<ParentEdgeCandidate> edges;
    Map<String, Integer> prunedReasonCounts;
    List<String> warnings;
}
