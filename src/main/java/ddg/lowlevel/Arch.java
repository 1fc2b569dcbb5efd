package ddg.lowlevel;

import java.util.Optional;

/**
 * Register layout of the analyzed architecture.
 */
public interface Arch {

    /**
     * Size of the register starting at {@code offset}.
     *
     * @param offset register offset
     * @return size in bytes, or empty if no register is known at that offset
     */
    Optional<Integer> registerSize(int offset);
}
