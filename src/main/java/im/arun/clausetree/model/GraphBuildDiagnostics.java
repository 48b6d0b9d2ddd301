package im.arun.clausetree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Graph build statistics and pruning diagnostics.
 */
@Value
public class GraphBuildDiagnostics {

    @JsonProperty("graph_stats")
    Map<String, Integer> graphStats;

    @JsonProperty("pruned_edges_by_reason")
    Map<String, Integer> prunedEdgesByReason;

    @JsonProperty("ambiguous_tokens")
    List<String> ambiguousTokens;

    @JsonProperty("construction_warnings")
    List<String> constructionWarnings;

    public GraphBuildDiagnostics(Map<String, Integer> graphStats,
                                 Map<String, Integer> prunedEdgesByReason,
                                 List<String> ambiguousTokens,
                                 List<String> constructionWarnings) {
        this.graphStats = Collections.unmodifiableMap(new TreeMap<>(graphStats));
        this.prunedEdgesByReason = Collections.unmodifiableMap(new TreeMap<>(prunedEdgesByReason));
        this.ambiguousTokens = ambiguousTokens.stream().sorted().distinct().toList();
        this.constructionWarnings = constructionWarnings.stream().sorted().distinct().toList();
    }
}
