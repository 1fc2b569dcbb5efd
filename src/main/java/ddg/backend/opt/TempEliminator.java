package ddg.backend.opt;

import ddg.backend.graph.DiGraph;
import ddg.backend.graph.EdgeLabels;
import ddg.variable.ProgramVariable;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Simplify a data dependence graph by removing every temporary node.
 * <p>
 * Each predecessor of a temporary is linked directly to each of its successors. The new edge carries the labels of
 * the incoming edge with the labels of the outgoing edge laid over them. The input graph is left untouched.
 */
public class TempEliminator implements UnaryOperator<DiGraph<ProgramVariable>> {

    @Override
    public DiGraph<ProgramVariable> apply(DiGraph<ProgramVariable> dataGraph) {
        var graph = new DiGraph<>(dataGraph);

        var temps = graph.nodes().stream()
                .filter(node -> node.variable.isTemporary())
                .collect(Collectors.toList());

        for (var temp : temps) {
            var inEdges = new ArrayList<Pair<ProgramVariable, EdgeLabels>>();
            for (var pred : graph.predecessors(temp)) {
                if (!pred.equals(temp)) {
                    inEdges.add(Pair.of(pred, graph.labels(pred, temp).get()));
                }
            }
            var outEdges = new ArrayList<Pair<ProgramVariable, EdgeLabels>>();
            for (var succ : graph.successors(temp)) {
                if (!succ.equals(temp)) {
                    outEdges.add(Pair.of(succ, graph.labels(temp, succ).get()));
                }
            }

            graph.removeNode(temp);

            for (var in : inEdges) {
                for (var out : outEdges) {
                    graph.putEdge(in.getLeft(), out.getLeft(), in.getRight().overlaidWith(out.getRight()));
                }
            }
        }
        return graph;
    }
}
