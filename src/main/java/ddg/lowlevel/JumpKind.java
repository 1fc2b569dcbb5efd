package ddg.lowlevel;

/**
 * Kind of a control transfer.
 */
public enum JumpKind {
    CALL, RETURN,
    /**
     * The speculative continuation after a call, assuming the callee returns.
     */
    FAKE_RETURN,
    ORDINARY;

    /**
     * Call depth after taking a transfer of this kind.
     *
     * @param depth call depth before the transfer
     * @return call depth after the transfer
     */
    public int nextDepth(int depth) {
        return switch (this) {
            case CALL -> depth + 1;
            case RETURN -> depth - 1;
            default -> depth;
        };
    }
}
