package im.arun.clausetree.util;

import im.arun.clausetree.model.SolvedClauseNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers over solved clause trees, where a node's parent is referenced by
 * dotted clause id ("a.i.A" is a child of "a.i").
 */
public final class ClauseTreeUtils {

    private ClauseTreeUtils() {
    }

    /**
     * Parent clause id of a dotted path.
     * e.g., "a.ii.B" -> "a.ii", "a" -> ""
     */
    public static String parentClauseId(String clauseId) {
        if (clauseId == null || clauseId.isEmpty()) {
            return "";
        }
        int dot = clauseId.lastIndexOf('.');
        return dot < 0 ? "" : clauseId.substring(0, dot);
    }

    /**
     * Last segment of a dotted path, without any duplicate-label suffix.
     * e.g., "a.ii_2" -> "ii"
     */
    public static String leafLabel(String clauseId) {
        String segment = clauseId.substring(clauseId.lastIndexOf('.') + 1);
        int suffix = segment.lastIndexOf('_');
        if (suffix > 0 && segment.substring(suffix + 1).chars().allMatch(Character::isDigit)) {
            return segment.substring(0, suffix);
        }
        return segment;
    }

    /**
     * Nodes grouped by parent clause id ("" for top-level nodes), each group in
     * input order.
     */
    public static Map<String, List<SolvedClauseNode>> groupByParent(List<SolvedClauseNode> nodes) {
        Map<String, List<SolvedClauseNode>> grouped = new LinkedHashMap<>();
        for (SolvedClauseNode node : nodes) {
            grouped.computeIfAbsent(node.getParentId(), k -> new ArrayList<>()).add(node);
        }
        return grouped;
    }

    /**
     * Structural violations of a solved tree; empty when the tree is well formed.
     * <ul>
     *   <li>every parent id resolves to a node in the list</li>
     *   <li>a child is strictly deeper than its parent</li>
     *   <li>sibling spans do not overlap</li>
     *   <li>no node is its own ancestor</li>
     * </ul>
     */
    public static List<String> findViolations(List<SolvedClauseNode> nodes) {
        List<String> violations = new ArrayList<>();
        Map<String, SolvedClauseNode> byId = new HashMap<>();
        for (SolvedClauseNode node : nodes) {
            if (byId.put(node.getClauseId(), node) != null) {
                violations.add("duplicate_clause_id:" + node.getClauseId());
            }
        }

        for (SolvedClauseNode node : nodes) {
            if (node.isRoot()) {
                continue;
            }
            SolvedClauseNode parent = byId.get(node.getParentId());
            if (parent == null) {
                violations.add("unresolved_parent:" + node.getClauseId());
                continue;
            }
            if (parent.getDepth() >= node.getDepth()) {
                violations.add("non_increasing_depth:" + node.getClauseId());
            }
            Set<String> seen = new HashSet<>();
            SolvedClauseNode cursor = node;
            while (cursor != null && !cursor.isRoot()) {
                if (!seen.add(cursor.getClauseId())) {
                    violations.add("cycle:" + node.getClauseId());
                    break;
                }
                cursor = byId.get(cursor.getParentId());
            }
        }

        for (List<SolvedClauseNode> siblings : groupByParent(nodes).values()) {
            for (int i = 0; i < siblings.size(); i++) {
                for (int j = i + 1; j < siblings.size(); j++) {
                    SolvedClauseNode a = siblings.get(i);
                    SolvedClauseNode b = siblings.get(j);
                    if (a.getSpanStart() < b.getSpanEnd() && b.getSpanStart() < a.getSpanEnd()) {
                        violations.add("overlapping_siblings:" + a.getClauseId() + ":" + b.getClauseId());
                    }
                }
            }
        }
        return violations;
    }
}
