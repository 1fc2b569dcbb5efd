package ddg.backend.func;

import ddg.backend.graph.DiGraph;
import ddg.backend.graph.EdgeLabels;
import ddg.cfg.Function;
import ddg.testing.FakeFunction;
import ddg.variable.CodeLocation;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class FunctionProjectorTest {

    private final Function f = new FakeFunction("f", 0x1000L, 0x1010L);
    private final Function g = new FakeFunction("g", 0x5000L);

    private final CodeLocation f1 = CodeLocation.of(0x1000, 0);
    private final CodeLocation f2 = CodeLocation.of(0x1010, 3);
    private final CodeLocation g1 = CodeLocation.of(0x5000, 1);
    private final CodeLocation unknown = CodeLocation.of(0x9000, 0);
    private final CodeLocation proc = CodeLocation.ofProcedure("puts");

    private Map<Function, DiGraph<CodeLocation>> project(DiGraph<CodeLocation> stmtGraph) {
        return new FunctionProjector(Map.of(0x1000L, f, 0x1010L, f, 0x5000L, g)).project(stmtGraph);
    }

    @Test
    public void testEdgesGoToOwningFunctions() {
        var stmtGraph = new DiGraph<CodeLocation>();
        stmtGraph.addEdge(f1, f2, EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG));
        stmtGraph.addEdge(f2, g1);
        stmtGraph.addEdge(proc, g1);
        stmtGraph.addEdge(unknown, proc);

        var byFunction = project(stmtGraph);

        var fGraph = byFunction.get(f);
        assertTrue(fGraph.hasEdge(f1, f2));
        assertTrue(fGraph.hasEdge(f2, g1));
        assertThat(fGraph.numEdges(), is(2));
        assertThat(fGraph.labels(f1, f2).get().get(EdgeLabels.TYPE).get(), is(EdgeLabels.REG));

        var gGraph = byFunction.get(g);
        assertTrue(gGraph.hasEdge(f2, g1));
        assertTrue(gGraph.hasEdge(proc, g1));
        assertThat(gGraph.numEdges(), is(2));

        assertThat(byFunction.size(), is(2));
    }

    @Test
    public void testEveryEdgeTouchingFunctionIsProjected() {
        var stmtGraph = new DiGraph<CodeLocation>();
        stmtGraph.addEdge(f1, f2);
        stmtGraph.addEdge(g1, f1);
        stmtGraph.addEdge(unknown, f2);
        stmtGraph.addEdge(unknown, proc);

        var byFunction = project(stmtGraph);

        for (var edge : stmtGraph.edges()) {
            for (var func : new Function[]{f, g}) {
                var touches = func.blocks().contains(edge.getLeft().blockAddr.orElse(-1L))
                        || func.blocks().contains(edge.getRight().blockAddr.orElse(-1L));
                if (touches) {
                    assertTrue(byFunction.get(func).hasEdge(edge.getLeft(), edge.getRight()));
                }
            }
        }
    }

    @Test
    public void testProjectedLabelsAreCopies() {
        var stmtGraph = new DiGraph<CodeLocation>();
        stmtGraph.addEdge(f1, g1, EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.REG));

        var byFunction = project(stmtGraph);
        byFunction.get(f).annotateEdges(List.of(Pair.of(f1, g1)), EdgeLabels.SUBTYPE, EdgeLabels.MEM_ADDR);

        assertTrue(byFunction.get(f).labels(f1, g1).get().containsKey(EdgeLabels.SUBTYPE));
        assertFalse(byFunction.get(g).labels(f1, g1).get().containsKey(EdgeLabels.SUBTYPE));
        assertFalse(stmtGraph.labels(f1, g1).get().containsKey(EdgeLabels.SUBTYPE));
    }
}
