package ddg.cfg;

import ddg.lowlevel.JumpKind;

public final class CfgEdge {

    public final CfgNode src;

    public final CfgNode dst;

    public final JumpKind jumpKind;

    public CfgEdge(CfgNode src, CfgNode dst, JumpKind jumpKind) {
        this.src = src;
        this.dst = dst;
        this.jumpKind = jumpKind;
    }

    @Override
    public String toString() {
        return src + " -> " + dst + " (" + jumpKind + ")";
    }
}
