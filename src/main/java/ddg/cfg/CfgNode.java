package ddg.cfg;

import ddg.lowlevel.ExecState;

import java.util.List;

/**
 * A basic block of the CFG, together with the states its execution ended in.
 */
public interface CfgNode {

    long addr();

    /**
     * Final states of the node. There is usually one per successor.
     */
    List<ExecState> finalStates();
}
