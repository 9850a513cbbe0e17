package work.agentflow.kernel.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Immutable directed graph produced by lowering. Node order is lowering order and doubles as
 * the node ordering used by variable checks. Structural changes return a new graph.
 */
public final class WorkflowGraph {
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<String, GraphNode> byId = new LinkedHashMap<>();
    private final Map<String, Integer> order = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> incoming = new LinkedHashMap<>();
    private final Map<String, List<GraphEdge>> outgoing = new LinkedHashMap<>();

    public WorkflowGraph(List<GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        for (int i = 0; i < this.nodes.size(); i++) {
            var node = this.nodes.get(i);
            if (byId.put(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
            order.put(node.id(), i);
            incoming.put(node.id(), new ArrayList<>());
            outgoing.put(node.id(), new ArrayList<>());
        }
        for (var edge : this.edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge references unknown node: " + edge);
            }
            outgoing.get(edge.from()).add(edge);
            incoming.get(edge.to()).add(edge);
        }
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public GraphNode node(String id) {
        var node = byId.get(id);
        if (node == null) {
            throw new NoSuchElementException("Unknown node id: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int indexOf(String id) {
        var index = order.get(id);
        return index == null ? -1 : index;
    }

    public List<GraphEdge> incoming(String id) {
        return Collections.unmodifiableList(incoming.getOrDefault(id, List.of()));
    }

    public List<GraphEdge> outgoing(String id) {
        return Collections.unmodifiableList(outgoing.getOrDefault(id, List.of()));
    }

    public List<GraphEdge> forwardIncoming(String id) {
        return incoming(id).stream().filter(edge -> !edge.backEdge()).toList();
    }

    public List<GraphEdge> forwardOutgoing(String id) {
        return outgoing(id).stream().filter(edge -> !edge.backEdge()).toList();
    }

    /**
     * Nodes with no incoming edge, plus the first node (which may be a loop target).
     */
    public List<GraphNode> startNodes() {
        var starts = new ArrayList<GraphNode>();
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (i == 0 || incoming(node.id()).isEmpty()) {
                starts.add(node);
            }
        }
        return starts;
    }

    /**
     * {@code id} and every node reachable from it over forward edges, in graph order.
     */
    public Set<String> forwardReachable(String id) {
        return traverse(id, true);
    }

    /**
     * Every node that reaches {@code id} over forward edges, excluding {@code id} itself.
     */
    public Set<String> forwardAncestors(String id) {
        var ancestors = traverse(id, false);
        ancestors.remove(id);
        return ancestors;
    }

    private Set<String> traverse(String start, boolean downstream) {
        var seen = new LinkedHashSet<String>();
        if (!byId.containsKey(start)) {
            return seen;
        }
        var queue = new ArrayDeque<String>();
        queue.add(start);
        seen.add(start);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            var next = downstream ? forwardOutgoing(current) : forwardIncoming(current);
            for (var edge : next) {
                var neighbour = downstream ? edge.to() : edge.from();
                if (seen.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        var ordered = new LinkedHashSet<String>();
        for (var node : nodes) {
            if (seen.contains(node.id())) {
                ordered.add(node.id());
            }
        }
        return ordered;
    }

    public String nextId() {
        int max = 0;
        for (var node : nodes) {
            if (node.id().startsWith("n")) {
                try {
                    max = Math.max(max, Integer.parseInt(node.id().substring(1)));
                } catch (NumberFormatException ignored) {
                    // foreign id scheme, does not take part in numbering
                }
            }
        }
        return "n" + (max + 1);
    }

    /**
     * Splices a region in front of {@code targetId}: every edge into the target is redirected to
     * {@code regionEntry}, and {@code regionExit -> targetId} is added. New nodes are placed just
     * before the target in node order.
     */
    public WorkflowGraph insertBefore(String targetId, List<GraphNode> regionNodes, List<GraphEdge> regionEdges, String regionEntry, String regionExit) {
        node(targetId);
        var newNodes = new ArrayList<GraphNode>();
        for (var node : nodes) {
            if (node.id().equals(targetId)) {
                newNodes.addAll(regionNodes);
            }
            newNodes.add(node);
        }
        var newEdges = new ArrayList<GraphEdge>();
        for (var edge : edges) {
            newEdges.add(edge.to().equals(targetId) ? edge.redirectTo(regionEntry) : edge);
        }
        newEdges.addAll(regionEdges);
        newEdges.add(GraphEdge.of(regionExit, targetId));
        return new WorkflowGraph(newNodes, newEdges);
    }

    public List<GraphNode> steps() {
        return nodes.stream().filter(GraphNode::isStep).toList();
    }

    @Override
    public String toString() {
        return "WorkflowGraph{nodes=" + nodes.size() + ", edges=" + edges + "}";
    }
}
