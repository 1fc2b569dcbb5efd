package ddg.backend.graph;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Directed graph with labeled edges.
 * <p>
 * Nodes are interned to integer handles; adjacency is kept per handle. Handles of removed nodes are never reused.
 * At most one edge exists between an ordered pair of nodes: adding it again is a no-op.
 *
 * @param <N> node type, compared by {@code equals}
 */
public class DiGraph<N> {

    private final HashMap<N, Integer> nodeToHandle = new HashMap<>();

    private final ArrayList<N> nodes = new ArrayList<>();

    private final ArrayList<LinkedHashMap<Integer, EdgeLabels>> succs = new ArrayList<>();

    private final ArrayList<LinkedHashSet<Integer>> preds = new ArrayList<>();

    private int numEdges = 0;

    /**
     * Bumped on every mutation, so that derived structures can tell whether they are stale.
     */
    private long version = 0;

    private boolean frozen = false;

    public DiGraph() {
    }

    /**
     * Copy a graph, including edge labels. The copy shares no mutable state with the original.
     *
     * @param other graph to copy
     */
    public DiGraph(DiGraph<N> other) {
        for (var node : other.nodes()) {
            addNode(node);
        }
        for (var edge : other.edges()) {
            addEdge(edge.getLeft(), edge.getRight(), other.storedLabels(edge.getLeft(), edge.getRight()));
        }
    }

    /**
     * Reject every later mutation of this graph with {@link UnsupportedOperationException}. Copies made with
     * {@link #DiGraph(DiGraph)} are mutable again.
     *
     * @return this graph
     */
    public DiGraph<N> freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("graph is frozen");
        }
    }

    public long version() {
        return version;
    }

    public int numNodes() {
        return nodeToHandle.size();
    }

    public int numEdges() {
        return numEdges;
    }

    public boolean contains(N node) {
        return nodeToHandle.containsKey(node);
    }

    /**
     * Add a node if absent.
     *
     * @param node node
     * @return true if the node is new
     */
    public boolean addNode(N node) {
        checkMutable();
        if (nodeToHandle.containsKey(node)) {
            return false;
        }
        nodeToHandle.put(node, nodes.size());
        nodes.add(node);
        succs.add(new LinkedHashMap<>());
        preds.add(new LinkedHashSet<>());
        version++;
        return true;
    }

    public boolean hasEdge(N src, N dst) {
        var srcHandle = nodeToHandle.get(src);
        var dstHandle = nodeToHandle.get(dst);
        return srcHandle != null && dstHandle != null && succs.get(srcHandle).containsKey(dstHandle);
    }

    /**
     * Add an edge, adding its endpoints if needed. If the edge already exists, nothing changes, its labels included.
     *
     * @param src    source
     * @param dst    destination
     * @param labels labels of the new edge; the graph keeps a copy
     * @return true if the edge is new
     */
    public boolean addEdge(N src, N dst, EdgeLabels labels) {
        checkMutable();
        if (hasEdge(src, dst)) {
            return false;
        }
        addNode(src);
        addNode(dst);
        int srcHandle = nodeToHandle.get(src);
        int dstHandle = nodeToHandle.get(dst);
        succs.get(srcHandle).put(dstHandle, labels.copy());
        preds.get(dstHandle).add(srcHandle);
        numEdges++;
        version++;
        return true;
    }

    /**
     * Add an edge, or lay {@code labels} over the labels of the existing one.
     *
     * @param src    source
     * @param dst    destination
     * @param labels labels; on a key collision these win
     */
    public void putEdge(N src, N dst, EdgeLabels labels) {
        if (!addEdge(src, dst, labels)) {
            var handle = nodeToHandle.get(src);
            var dstHandle = nodeToHandle.get(dst);
            succs.get(handle).put(dstHandle, succs.get(handle).get(dstHandle).overlaidWith(labels));
            version++;
        }
    }

    public boolean addEdge(N src, N dst) {
        return addEdge(src, dst, new EdgeLabels());
    }

    /**
     * Append {@code value} to the {@code key} tuple of every listed edge. Edges no longer in the graph are skipped.
     *
     * @param edges edges to annotate
     * @param key   label key
     * @param value value to append
     */
    public void annotateEdges(Collection<Pair<N, N>> edges, String key, Object value) {
        checkMutable();
        for (var edge : edges) {
            if (hasEdge(edge.getLeft(), edge.getRight())) {
                storedLabels(edge.getLeft(), edge.getRight()).append(key, value);
                version++;
            }
        }
    }

    /**
     * Labels of an edge. The result is a copy: labels of an existing edge change only through
     * {@link #annotateEdges} and {@link #putEdge}.
     *
     * @param src source
     * @param dst destination
     * @return a copy of the labels, or empty if there is no such edge
     */
    public Optional<EdgeLabels> labels(N src, N dst) {
        if (!hasEdge(src, dst)) {
            return Optional.empty();
        }
        return Optional.of(storedLabels(src, dst).copy());
    }

    private EdgeLabels storedLabels(N src, N dst) {
        return succs.get(nodeToHandle.get(src)).get(nodeToHandle.get(dst));
    }

    /**
     * Remove a node together with all its incident edges.
     *
     * @param node node
     * @return true if the node was present
     */
    public boolean removeNode(N node) {
        checkMutable();
        var handle = nodeToHandle.get(node);
        if (handle == null) {
            return false;
        }
        for (var succ : succs.get(handle).keySet()) {
            if (succ.intValue() != handle) {
                preds.get(succ).remove(handle);
            }
        }
        for (var pred : preds.get(handle)) {
            if (pred.intValue() != handle) {
                succs.get(pred).remove(handle);
            }
        }
        numEdges -= succs.get(handle).size() + preds.get(handle).size();
        if (succs.get(handle).containsKey(handle)) {
            numEdges++;
        }
        succs.get(handle).clear();
        preds.get(handle).clear();
        nodes.set(handle, null);
        nodeToHandle.remove(node);
        version++;
        return true;
    }

    /**
     * @return live nodes, in insertion order
     */
    public List<N> nodes() {
        var result = new ArrayList<N>(nodeToHandle.size());
        for (var node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * @return all edges as (src, dst) pairs, grouped by source in node insertion order
     */
    public List<Pair<N, N>> edges() {
        var result = new ArrayList<Pair<N, N>>(numEdges);
        for (var handle = 0; handle < nodes.size(); handle++) {
            var src = nodes.get(handle);
            if (src == null) {
                continue;
            }
            for (var dst : succs.get(handle).keySet()) {
                result.add(Pair.of(src, nodes.get(dst)));
            }
        }
        return result;
    }

    public List<N> successors(N node) {
        var result = new ArrayList<N>();
        var handle = nodeToHandle.get(node);
        if (handle != null) {
            succs.get(handle).keySet().forEach(succ -> result.add(nodes.get(succ)));
        }
        return result;
    }

    public List<N> predecessors(N node) {
        var result = new ArrayList<N>();
        var handle = nodeToHandle.get(node);
        if (handle != null) {
            preds.get(handle).forEach(pred -> result.add(nodes.get(pred)));
        }
        return result;
    }

    @Override
    public String toString() {
        return "DiGraph with " + numNodes() + " nodes and " + numEdges() + " edges";
    }
}
