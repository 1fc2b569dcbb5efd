package ddg.backend;

import ddg.backend.dataflow.LiveDefs;
import ddg.backend.func.FunctionProjector;
import ddg.backend.graph.DiGraph;
import ddg.backend.opt.TempEliminator;
import ddg.cfg.CfgNode;
import ddg.cfg.Function;
import ddg.cfg.FunctionManager;
import ddg.variable.CodeLocation;
import ddg.variable.ProgramVariable;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a data dependence analysis.
 * <p>
 * Holds the statement dependence graph (code location to code location), the data dependence graph (program
 * variable to program variable) and the definitions reaching every analyzed CFG node. The simplified data graph and
 * the per-function graphs are derived on first request and cached.
 */
public class Ddg {

    private final DiGraph<CodeLocation> stmtGraph = new DiGraph<>();

    private final DiGraph<ProgramVariable> dataGraph = new DiGraph<>();

    private final HashMap<CfgNode, LiveDefs> liveDefsPerNode = new HashMap<>();

    private final FunctionManager functionManager;

    private DiGraph<ProgramVariable> simplifiedDataGraph = null;

    /**
     * Version of {@link #dataGraph} the cached simplified graph was computed from.
     */
    private long simplifiedVersion = -1;

    private Map<Function, DiGraph<CodeLocation>> functionDependencies = null;

    public Ddg(FunctionManager functionManager) {
        this.functionManager = functionManager;
    }

    /**
     * @return the statement dependence graph
     */
    public DiGraph<CodeLocation> graph() {
        return stmtGraph;
    }

    public DiGraph<ProgramVariable> dataGraph() {
        return dataGraph;
    }

    /**
     * The data graph without temporaries. Recomputed whenever the data graph changed since the last call. The
     * returned graph is frozen; copy it with {@link DiGraph#DiGraph(DiGraph)} to edit it.
     *
     * @return simplified data graph
     */
    public DiGraph<ProgramVariable> simplifiedDataGraph() {
        if (simplifiedDataGraph == null || simplifiedVersion != dataGraph.version()) {
            simplifiedDataGraph = new TempEliminator().apply(dataGraph).freeze();
            simplifiedVersion = dataGraph.version();
        }
        return simplifiedDataGraph;
    }

    public boolean contains(CodeLocation location) {
        return stmtGraph.contains(location);
    }

    public List<CodeLocation> getPredecessors(CodeLocation location) {
        return stmtGraph.predecessors(location);
    }

    /**
     * Dependence graph of a single function. The per-function graphs are built once, on the first call.
     *
     * @param func function
     * @return its dependence graph, or empty if no dependence touches the function
     */
    public Optional<DiGraph<CodeLocation>> functionDependencyGraph(Function func) {
        if (functionDependencies == null) {
            functionDependencies = new FunctionProjector(functionManager.blockIndex()).project(stmtGraph);
        }
        return Optional.ofNullable(functionDependencies.get(func));
    }

    /**
     * @param node CFG node
     * @return a copy of the definitions reaching {@code node}, or empty if the analysis never reached it
     */
    public Optional<LiveDefs> liveDefsOf(CfgNode node) {
        return Optional.ofNullable(liveDefsPerNode.get(node)).map(LiveDefs::copy);
    }

    LiveDefs liveDefsFor(CfgNode node) {
        return liveDefsPerNode.computeIfAbsent(node, n -> new LiveDefs());
    }

    /**
     * Print every statement dependence, one per line.
     *
     * @param pw output
     */
    public void printTo(PrintWriter pw) {
        for (var edge : stmtGraph.edges()) {
            var src = edge.getLeft();
            var dst = edge.getRight();
            pw.println(dst + " <-- " + src + ", " + stmtGraph.labels(src, dst).get());
        }
        pw.flush();
    }

    @Override
    public String toString() {
        return "<Ddg: " + stmtGraph.numNodes() + " statements, " + stmtGraph.numEdges() + " statement dependencies, "
                + dataGraph.numNodes() + " program variables, " + dataGraph.numEdges() + " data dependencies>";
    }
}
