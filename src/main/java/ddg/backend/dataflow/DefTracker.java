package ddg.backend.dataflow;

import ddg.backend.graph.DiGraph;
import ddg.backend.graph.EdgeLabels;
import ddg.driver.error.UnknownVariableKindError;
import ddg.lowlevel.Arch;
import ddg.lowlevel.ExecState;
import ddg.lowlevel.action.Action;
import ddg.lowlevel.action.Operand;
import ddg.variable.CodeLocation;
import ddg.variable.ProgramVariable;
import ddg.variable.Variable;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks definitions through the action log of one final state.
 * <p>
 * Starting from the definitions reaching the node, the actions are scanned once, in order. Every use is linked to
 * its reaching definitions in the statement graph, every value flow is recorded in the data graph, and every write
 * kills the previous definitions of its variable. {@link #track()} returns the definitions leaving the node.
 * <p>
 * Temporaries never escape the node, so they are tracked in local maps only.
 */
public class DefTracker implements Action.Visitor {

    private static final Logger log = LoggerFactory.getLogger(DefTracker.class);

    private final ExecState state;

    private final Arch arch;

    private final boolean keepData;

    private final DiGraph<CodeLocation> stmtGraph;

    private final DiGraph<ProgramVariable> dataGraph;

    private final LiveDefs liveDefs;

    private final HashMap<Integer, CodeLocation> tempDefs = new HashMap<>();

    private final HashMap<Integer, ProgramVariable> tempVariables = new HashMap<>();

    /**
     * Statement graph edges recorded per register / temporary use, so that a later action of the same node can
     * annotate them. Cleared when the register or temporary is written again.
     */
    private final HashMap<Integer, List<Pair<CodeLocation, CodeLocation>>> regsToEdges = new HashMap<>();

    private final HashMap<Integer, List<Pair<CodeLocation, CodeLocation>>> tempsToEdges = new HashMap<>();

    private Optional<Integer> lastStmtIdx = Optional.empty();

    /**
     * Values read by the current statement, to be linked to the temporary the statement writes.
     */
    private List<ProgramVariable> dataRead = new ArrayList<>();

    /**
     * @param state     final state whose action log is tracked
     * @param liveDefs  definitions reaching the node; left untouched
     * @param arch      register layout
     * @param keepData  label edges with defined variables instead of counts
     * @param stmtGraph statement dependence graph to extend
     * @param dataGraph data dependence graph to extend
     */
    public DefTracker(ExecState state, LiveDefs liveDefs, Arch arch, boolean keepData,
                      DiGraph<CodeLocation> stmtGraph, DiGraph<ProgramVariable> dataGraph) {
        this.state = state;
        this.liveDefs = liveDefs.copy();
        this.arch = arch;
        this.keepData = keepData;
        this.stmtGraph = stmtGraph;
        this.dataGraph = dataGraph;
    }

    /**
     * Scan the whole action log.
     *
     * @return definitions live after the node
     */
    public LiveDefs track() {
        for (var action : state.actions()) {
            var stmtIdx = action.location.stmtIdx;
            if (lastStmtIdx.isEmpty() || !lastStmtIdx.equals(stmtIdx)) {
                dataRead = new ArrayList<>();
                lastStmtIdx = stmtIdx;
            }
            action.accept(this);
        }
        return liveDefs;
    }

    @Override
    public void visitMem(Action.Mem action) {
        var location = action.location;

        for (var addr : resolveAddresses(action)) {
            var variable = new Variable.Memory(addr, action.data.size);
            var pv = new ProgramVariable(variable, location);

            if (action.isRead()) {
                for (var prevDef : defLookup(liveDefs, variable, keepData).entrySet()) {
                    stmtGraph.addEdge(prevDef.getKey(), location, prevDef.getValue());
                }
                dataRead.add(pv);
            } else {
                liveDefs.kill(variable, location);
            }

            linkDependencies(action.addr, pv, EdgeLabels.MEM_ADDR);
            linkDependencies(action.data, pv, EdgeLabels.MEM_DATA);
        }
    }

    @Override
    public void visitReg(Action.Reg action) {
        var location = action.location;
        var variable = new Variable.Register(action.offset, action.size);

        if (action.isRead()) {
            var prevDefs = defLookup(liveDefs, variable, keepData);
            for (var prevDef : prevDefs.entrySet()) {
                var prevLoc = prevDef.getKey();
                stmtGraph.addEdge(prevLoc, location, prevDef.getValue());
                regsToEdges.computeIfAbsent(action.offset, k -> new ArrayList<>()).add(Pair.of(prevLoc, location));
                dataRead.add(new ProgramVariable(variable, prevLoc));
            }
            if (prevDefs.isEmpty()) {
                // never defined in the analyzed window, so it was passed in
                dataRead.add(new ProgramVariable(variable, location));
            }
            return;
        }

        liveDefs.kill(variable, location);
        regsToEdges.remove(action.offset);

        var pv = new ProgramVariable(variable, location);
        dataGraph.addNode(pv);
        if (action.regDeps.isEmpty() && action.tmpDeps.isEmpty()) {
            dataGraph.addEdge(new ProgramVariable(Variable.Constant.INSTANCE, location), pv);
        }
        for (var tmp : action.tmpDeps) {
            var tmpPv = tempVariables.get(tmp);
            if (tmpPv != null) {
                dataGraph.addEdge(tmpPv, pv);
            }
        }
    }

    @Override
    public void visitTmp(Action.Tmp action) {
        var location = action.location;

        if (action.isRead()) {
            var prevLoc = tempDef(action.tmp, action);
            var labels = EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.TMP, EdgeLabels.DATA, action.tmp);
            stmtGraph.addEdge(prevLoc, location, labels);
            tempsToEdges.computeIfAbsent(action.tmp, k -> new ArrayList<>()).add(Pair.of(prevLoc, location));
            return;
        }

        var pv = new ProgramVariable(new Variable.Temporary(action.tmp), location);
        tempDefs.put(action.tmp, location);
        tempVariables.put(action.tmp, pv);
        tempsToEdges.remove(action.tmp);

        for (var dep : action.tmpDeps) {
            var depPv = tempVariables.get(dep);
            if (depPv != null) {
                dataGraph.addEdge(depPv, pv);
            }
        }
        for (var data : dataRead) {
            dataGraph.addEdge(data, pv);
        }
    }

    @Override
    public void visitExit(Action.Exit action) {
        var location = action.location;
        for (var tmp : action.tmpDeps) {
            var prevLoc = tempDef(tmp, action);
            var labels = EdgeLabels.of(EdgeLabels.TYPE, EdgeLabels.EXIT, EdgeLabels.DATA, EdgeLabels.TMP);
            stmtGraph.addEdge(prevLoc, location, labels);
            tempsToEdges.computeIfAbsent(tmp, k -> new ArrayList<>()).add(Pair.of(prevLoc, location));
        }
    }

    /**
     * Build the statement graph labels for a use of {@code variable}: one label set per reaching definition.
     * <p>
     * Labels carry the variable itself if {@code keepData} is set, otherwise a count of the other definitions of the
     * variable resolving to the same location.
     *
     * @param liveDefs reaching definitions
     * @param variable a register or memory variable
     * @param keepData label with the variable rather than a count
     * @return defining location to labels
     * @throws UnknownVariableKindError if {@code variable} has reaching definitions but is neither a register nor a
     *                                  memory cell
     */
    static Map<CodeLocation, EdgeLabels> defLookup(LiveDefs liveDefs, Variable variable, boolean keepData) {
        var prevDefs = new LinkedHashMap<CodeLocation, EdgeLabels>();

        for (var codeLoc : liveDefs.lookup(variable)) {
            String type;
            if (variable.isMemory()) {
                type = EdgeLabels.MEM;
            } else if (variable.isRegister()) {
                type = EdgeLabels.REG;
            } else {
                throw new UnknownVariableKindError(variable);
            }

            if (keepData) {
                prevDefs.put(codeLoc, EdgeLabels.of(EdgeLabels.TYPE, type, EdgeLabels.DATA, variable));
            } else {
                // lookup yields each location once, so no earlier definition shares it
                prevDefs.put(codeLoc, EdgeLabels.of(EdgeLabels.TYPE, type, EdgeLabels.COUNT, 0));
            }
        }
        return prevDefs;
    }

    /**
     * Link the registers and temporaries an operand of a memory access was computed from to the accessed cell, and
     * annotate the statement graph edges of their uses with {@code subtype}.
     */
    private void linkDependencies(Operand operand, ProgramVariable pv, String subtype) {
        for (var regOffset : operand.regDeps) {
            stmtGraph.annotateEdges(regsToEdges.getOrDefault(regOffset, List.of()), EdgeLabels.SUBTYPE, subtype);
            var regVariable = new Variable.Register(regOffset, registerSize(regOffset));
            for (var loc : liveDefs.lookup(regVariable)) {
                dataGraph.addEdge(new ProgramVariable(regVariable, loc), pv, EdgeLabels.of(EdgeLabels.TYPE, subtype));
            }
        }

        for (var tmp : operand.tmpDeps) {
            stmtGraph.annotateEdges(tempsToEdges.getOrDefault(tmp, List.of()), EdgeLabels.SUBTYPE, subtype);
            var tmpPv = tempVariables.get(tmp);
            if (tmpPv != null) {
                dataGraph.addEdge(tmpPv, pv, EdgeLabels.of(EdgeLabels.TYPE, subtype));
            }
        }
    }

    private Set<Long> resolveAddresses(Action.Mem action) {
        if (action.actualAddrs.isPresent()) {
            return action.actualAddrs.get();
        }
        var addrs = new LinkedHashSet<Long>();
        var concrete = state.evalConcrete(action.addr);
        if (concrete.isPresent()) {
            addrs.add(concrete.get());
        } else {
            log.debug("symbolic address at {}, using {}", action.location,
                    Long.toHexString(Variable.Memory.SENTINEL_ADDRESS));
            addrs.add(Variable.Memory.SENTINEL_ADDRESS);
        }
        return addrs;
    }

    private int registerSize(int offset) {
        var size = arch.registerSize(offset);
        if (size.isEmpty()) {
            log.warn("unsupported register offset {}, assuming size 1", offset);
            return 1;
        }
        return size.get();
    }

    private CodeLocation tempDef(int tmp, Action action) {
        var loc = tempDefs.get(tmp);
        if (loc == null) {
            throw new IllegalStateException("temporary t" + tmp + " used before definition by " + action);
        }
        return loc;
    }
}
