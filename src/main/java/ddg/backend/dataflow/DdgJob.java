package ddg.backend.dataflow;

import ddg.cfg.CfgNode;

/**
 * A unit of work: a CFG node to process, tagged with the call depth it was reached at.
 */
public final class DdgJob {

    public final CfgNode cfgNode;

    public final int callDepth;

    public DdgJob(CfgNode cfgNode, int callDepth) {
        this.cfgNode = cfgNode;
        this.callDepth = callDepth;
    }

    @Override
    public String toString() {
        return "<DdgJob " + cfgNode + ", call depth " + callDepth + ">";
    }
}
