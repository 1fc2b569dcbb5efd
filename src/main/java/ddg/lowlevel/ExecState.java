package ddg.lowlevel;

import ddg.lowlevel.action.Action;
import ddg.lowlevel.action.Operand;

import java.util.List;
import java.util.Optional;

/**
 * A final execution state of a CFG node, i.e. one outcome of executing the node.
 */
public interface ExecState {

    JumpKind jumpKind();

    /**
     * Address of the next instruction.
     *
     * @return the address, or empty if it is symbolic
     */
    Optional<Long> ip();

    /**
     * Every event recorded while executing the node, in order.
     */
    List<Action> actions();

    /**
     * Try to evaluate an operand to a single concrete value.
     *
     * @param operand operand
     * @return the value, or empty if the operand is symbolic or unsatisfiable
     */
    Optional<Long> evalConcrete(Operand operand);
}
