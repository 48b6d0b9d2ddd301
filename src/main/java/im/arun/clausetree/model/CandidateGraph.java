package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node and parent-edge hypotheses for one section, built once and never mutated.
 */
@Value
public class CandidateGraph {

    @JsonProperty("node_candidates")
    List<ClauseNodeCandidate> nodeCandidates;

    @JsonProperty("parent_edge_candidates")
    List<ParentEdgeCandidate> parentEdgeCandidates;

    @JsonProperty("diagnostics")
    GraphBuildDiagnostics diagnostics;

    @JsonIgnore
    Map<String, ClauseNodeCandidate> candidatesById;

    public CandidateGraph(List<ClauseNodeCandidate> nodeCandidates,
                          List<ParentEdgeCandidate> parentEdgeCandidates,
                          GraphBuildDiagnostics diagnostics) {
        this.nodeCandidates = List.copyOf(nodeCandidates);
        this.parentEdgeCandidates = List.copyOf(parentEdgeCandidates);
        this.diagnostics = diagnostics;
        Map<String, ClauseNodeCandidate> byId = new LinkedHashMap<>();
        for (ClauseNodeCandidate candidate : this.nodeCandidates) {
            byId.put(candidate.getNodeCandidateId(), candidate);
        }
        this.candidatesById = Collections.unmodifiableMap(byId);
    }

    public Optional<ClauseNodeCandidate> findCandidate(String nodeCandidateId) {
        return Optional.ofNullable(candidatesById.get(nodeCandidateId));
    }
}
