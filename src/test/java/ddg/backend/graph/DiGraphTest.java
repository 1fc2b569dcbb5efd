package ddg.backend.graph;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class DiGraphTest {

    @Test
    public void testAddEdgeTwiceKeepsFirstLabels() {
        var graph = new DiGraph<String>();
        assertTrue(graph.addEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG)));
        assertFalse(graph.addEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.MEM)));

        assertThat(graph.numEdges(), is(1));
        assertThat(graph.edges(), is(List.of(Pair.of("a", "b"))));
        assertThat(graph.labels("a", "b").get().get(EdgeLabels.TYPE).get(), is(EdgeLabels.REG));
    }

    @Test
    public void testAnnotateAppendsToTuple() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG));
        graph.annotateEdges(List.of(Pair.of("a", "b")), EdgeLabels.SUBTYPE, EdgeLabels.MEM_ADDR);
        graph.annotateEdges(List.of(Pair.of("a", "b")), EdgeLabels.SUBTYPE, EdgeLabels.MEM_DATA);

        var labels = graph.labels("a", "b").get();
        assertThat(labels.get(EdgeLabels.SUBTYPE).get(), is(List.of(EdgeLabels.MEM_ADDR, EdgeLabels.MEM_DATA)));
        assertThat(labels.get(EdgeLabels.TYPE).get(), is(EdgeLabels.REG));
    }

    @Test
    public void testAnnotateSkipsMissingEdges() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b");
        graph.annotateEdges(List.of(Pair.of("b", "a"), Pair.of("x", "y")), EdgeLabels.SUBTYPE, EdgeLabels.MEM_ADDR);

        assertThat(graph.numEdges(), is(1));
        assertFalse(graph.contains("x"));
        assertTrue(graph.labels("a", "b").get().isEmpty());
    }

    @Test
    public void testRemoveNodeDropsIncidentEdges() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "t");
        graph.addEdge("t", "b");
        graph.addEdge("t", "t");
        graph.addEdge("a", "b");

        assertTrue(graph.removeNode("t"));
        assertFalse(graph.contains("t"));
        assertThat(graph.numNodes(), is(2));
        assertThat(graph.numEdges(), is(1));
        assertThat(graph.successors("a"), is(List.of("b")));
        assertTrue(graph.predecessors("b").contains("a"));
        assertThat(graph.predecessors("b").size(), is(1));
    }

    @Test
    public void testCopyIsIndependent() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG));

        var copy = new DiGraph<>(graph);
        copy.annotateEdges(List.of(Pair.of("a", "b")), EdgeLabels.SUBTYPE, EdgeLabels.MEM_ADDR);
        copy.removeNode("b");

        assertTrue(graph.hasEdge("a", "b"));
        assertFalse(graph.labels("a", "b").get().containsKey(EdgeLabels.SUBTYPE));
    }

    @Test
    public void testLabelsAreCopies() {
        var graph = new DiGraph<String>();
        var labels = EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG);
        graph.addEdge("a", "b", labels);
        var version = graph.version();

        labels.put(EdgeLabels.TYPE, EdgeLabels.MEM);
        graph.labels("a", "b").get().put(EdgeLabels.TYPE, EdgeLabels.MEM_DATA);

        assertThat(graph.labels("a", "b").get().get(EdgeLabels.TYPE).get(), is(EdgeLabels.REG));
        assertThat(graph.version(), is(version));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testFrozenGraphRejectsAnnotation() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b");
        graph.freeze().annotateEdges(List.of(Pair.of("a", "b")), EdgeLabels.SUBTYPE, EdgeLabels.MEM_ADDR);
    }

    @Test
    public void testFrozenGraphRejectsEveryMutation() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b");
        graph.freeze();

        List<Runnable> mutations = List.of(
                () -> graph.addNode("c"),
                () -> graph.addEdge("b", "a"),
                () -> graph.putEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG)),
                () -> graph.removeNode("a"));
        for (var mutation : mutations) {
            try {
                mutation.run();
                fail("frozen graph accepted a mutation");
            } catch (UnsupportedOperationException e) {
                assertThat(graph.numEdges(), is(1));
            }
        }
        assertThat(graph.nodes(), is(List.of("a", "b")));
    }

    @Test
    public void testPutEdgeOverlaysLabels() {
        var graph = new DiGraph<String>();
        graph.putEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG, EdgeLabels.COUNT, 0));
        graph.putEdge("a", "b", EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.MEM_DATA));

        var labels = graph.labels("a", "b").get();
        assertThat(labels.get(EdgeLabels.TYPE).get(), is(EdgeLabels.MEM_DATA));
        assertThat(labels.get(EdgeLabels.COUNT).get(), is(0));
    }

    @Test
    public void testVersionChangesOnMutationOnly() {
        var graph = new DiGraph<String>();
        graph.addEdge("a", "b");
        var version = graph.version();

        graph.addEdge("a", "b");
        graph.addNode("a");
        assertThat(graph.version(), is(version));

        graph.addNode("c");
        assertNotEquals(version, graph.version());
    }
}
