package ddg.backend.func;

import ddg.backend.graph.DiGraph;
import ddg.cfg.Function;
import ddg.variable.CodeLocation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Split a statement dependence graph into one dependence graph per function.
 * <p>
 * An edge goes to the function owning the block of its source and to the function owning the block of its
 * destination; an edge between two functions thus shows up in both.
 */
public class FunctionProjector {

    private final Map<Long, Function> blockToFunction;

    /**
     * @param blockToFunction block start address to the function owning the block
     */
    public FunctionProjector(Map<Long, Function> blockToFunction) {
        this.blockToFunction = blockToFunction;
    }

    public Map<Function, DiGraph<CodeLocation>> project(DiGraph<CodeLocation> stmtGraph) {
        var dependencies = new LinkedHashMap<Function, DiGraph<CodeLocation>>();

        for (var edge : stmtGraph.edges()) {
            var src = edge.getLeft();
            var dst = edge.getRight();
            var labels = stmtGraph.labels(src, dst).get();

            var srcFunc = owner(src);
            srcFunc.ifPresent(func -> dependencies.computeIfAbsent(func, f -> new DiGraph<>())
                    .addEdge(src, dst, labels.copy()));

            var dstFunc = owner(dst);
            if (dstFunc.isPresent() && !dstFunc.equals(srcFunc)) {
                dependencies.computeIfAbsent(dstFunc.get(), f -> new DiGraph<>()).addEdge(src, dst, labels.copy());
            }
        }
        return dependencies;
    }

    private Optional<Function> owner(CodeLocation location) {
        return location.blockAddr.map(blockToFunction::get);
    }
}
