package ddg.cfg;

import java.util.Set;

/**
 * A function recovered alongside the CFG.
 */
public interface Function {

    String name();

    /**
     * Start addresses of the blocks belonging to this function.
     */
    Set<Long> blocks();
}
