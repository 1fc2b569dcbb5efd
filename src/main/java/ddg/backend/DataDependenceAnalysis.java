package ddg.backend;

import ddg.backend.dataflow.DdgJob;
import ddg.backend.dataflow.DefTracker;
import ddg.backend.dataflow.Worklist;
import ddg.cfg.Cfg;
import ddg.driver.Config;
import ddg.driver.Phase;
import ddg.driver.error.StateNotKeptError;
import ddg.lowlevel.Arch;
import ddg.lowlevel.JumpKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.PrintWriter;

/**
 * Data dependence analysis phase: build a {@link Ddg} directly from a CFG whose nodes kept their final states.
 * <p>
 * This is fast, not sound: it reuses whatever the CFG recovery computed, and trades accuracy for speed wherever
 * they conflict. Tracked are temporaries inside a node, registers, and memory cells with concrete addresses. All
 * symbolic memory accesses fall into one sentinel cell.
 * <p>
 * Definitions are propagated along the CFG with a work-list until nothing changes. A node's jobs carry the call
 * depth it was reached at, and nothing beyond the configured depth is traced.
 */
public class DataDependenceAnalysis extends Phase<Cfg, Ddg> {

    private static final Logger log = LoggerFactory.getLogger(DataDependenceAnalysis.class);

    private final Arch arch;

    public DataDependenceAnalysis(Config config, Arch arch) {
        super("ddg", config);
        this.arch = arch;
    }

    @Override
    public Ddg transform(Cfg cfg) {
        if (!cfg.keepsState()) {
            throw new StateNotKeptError();
        }

        var ddg = new Ddg(cfg.functionManager());
        var worklist = new Worklist(cfg, config.callDepth);

        // initial nodes are those without predecessors
        for (var node : cfg.nodes()) {
            if (cfg.inDegree(node) == 0) {
                worklist.append(new DdgJob(node, 0));
            }
        }

        while (!worklist.isEmpty()) {
            var job = worklist.poll();
            var node = job.cfgNode;
            var callDepth = job.callDepth;

            var finalStates = node.finalStates();
            var liveDefs = ddg.liveDefsFor(node);
            var successors = cfg.successors(node);

            for (var state : finalStates) {
                if (state.jumpKind() == JumpKind.FAKE_RETURN && finalStates.size() > 1) {
                    // other transitions are available, skip the speculative return
                    continue;
                }

                var newCallDepth = state.jumpKind().nextDepth(callDepth);
                if (config.callDepth.isPresent() && callDepth > config.callDepth.get()) {
                    log.debug("do not trace into {} due to the call depth limit", state.ip());
                    continue;
                }

                var newDefs = new DefTracker(state, liveDefs, arch, config.keepData, ddg.graph(), ddg.dataGraph())
                        .track();

                if (state.ip().isEmpty()) {
                    log.debug("symbolic successor of {}, dropping its definitions", node);
                    continue;
                }
                long ip = state.ip().get();
                var successor = successors.stream().filter(n -> n.addr() == ip).findFirst();
                if (successor.isEmpty()) {
                    continue;
                }

                var changed = ddg.liveDefsFor(successor.get()).mergeFrom(newDefs);
                if (changed && config.withinCallDepth(newCallDepth)) {
                    worklist.append(new DdgJob(successor.get(), newCallDepth));
                }
            }
        }
        return ddg;
    }

    @Override
    public void onSucceed(Ddg ddg) {
        log.info("built {}", ddg);
        if (config.dumpPath.isPresent()) {
            var path = config.dumpPath.get();
            try {
                var printer = new PrintWriter(path.toFile());
                ddg.printTo(printer);
                printer.close();
            } catch (FileNotFoundException e) {
                log.warn("cannot dump statement dependence graph to {}", path, e);
            }
        }
    }
}
