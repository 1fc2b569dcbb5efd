package ddg.backend.dataflow;

import ddg.cfg.Cfg;
import ddg.cfg.CfgNode;
import ddg.lowlevel.JumpKind;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * FIFO work-list of {@link DdgJob}s.
 * <p>
 * Jobs are deduplicated by CFG node only: while a node is pending, appending it again at another call depth is a
 * no-op. Appending a node also appends everything reachable from it without leaving the call-depth bound.
 */
public final class Worklist {

    private final Cfg cfg;

    private final Optional<Integer> callDepthBound;

    private final ArrayDeque<DdgJob> jobs = new ArrayDeque<>();

    private final HashSet<CfgNode> pending = new HashSet<>();

    public Worklist(Cfg cfg, Optional<Integer> callDepthBound) {
        this.cfg = cfg;
        this.callDepthBound = callDepthBound;
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }

    public int size() {
        return jobs.size();
    }

    public boolean isPending(CfgNode node) {
        return pending.contains(node);
    }

    public DdgJob poll() {
        var job = jobs.poll();
        if (job != null) {
            pending.remove(job.cfgNode);
        }
        return job;
    }

    /**
     * Append a job, then walk the CFG depth-first from its node and append every node not yet pending.
     * <p>
     * Call edges are followed only while below the bound, return edges only above depth 0.
     *
     * @param job job to append
     * @return nodes appended by this call, empty if the job's node was already pending
     */
    public Set<CfgNode> append(DdgJob job) {
        var inserted = new LinkedHashSet<CfgNode>();
        if (pending.contains(job.cfgNode)) {
            return inserted;
        }
        enqueue(job);
        inserted.add(job.cfgNode);

        var stack = new ArrayDeque<DdgJob>();
        stack.push(job);
        var traversed = new HashSet<CfgNode>();
        traversed.add(job.cfgNode);

        while (!stack.isEmpty()) {
            var current = stack.pop();
            var depth = current.callDepth;
            for (var edge : cfg.outEdges(current.cfgNode)) {
                var dst = edge.dst;
                if (traversed.contains(dst) || pending.contains(dst)) {
                    continue;
                }
                traversed.add(dst);

                if (edge.jumpKind == JumpKind.CALL) {
                    if (callDepthBound.isPresent() && depth >= callDepthBound.get()) {
                        continue;
                    }
                } else if (edge.jumpKind == JumpKind.RETURN) {
                    if (depth <= 0) {
                        continue;
                    }
                }
                var next = new DdgJob(dst, edge.jumpKind.nextDepth(depth));
                enqueue(next);
                inserted.add(dst);
                stack.push(next);
            }
        }
        return inserted;
    }

    private void enqueue(DdgJob job) {
        jobs.add(job);
        pending.add(job.cfgNode);
    }
}
