package ddg.variable;

import java.util.Objects;
import java.util.Optional;

/**
 * A program point: a statement inside a basic block, or a modeled external procedure.
 */
public final class CodeLocation {

    /**
     * Start address of the owning block. Empty for procedure locations.
     */
    public final Optional<Long> blockAddr;

    /**
     * Statement index inside the block. Empty for procedure locations.
     */
    public final Optional<Integer> stmtIdx;

    public final Optional<Long> insAddr;

    /**
     * Name of the modeled procedure this event originates from, if any.
     */
    public final Optional<String> procedure;

    private CodeLocation(Optional<Long> blockAddr, Optional<Integer> stmtIdx, Optional<Long> insAddr,
                         Optional<String> procedure) {
        this.blockAddr = blockAddr;
        this.stmtIdx = stmtIdx;
        this.insAddr = insAddr;
        this.procedure = procedure;
    }

    public static CodeLocation of(long blockAddr, int stmtIdx) {
        return new CodeLocation(Optional.of(blockAddr), Optional.of(stmtIdx), Optional.empty(), Optional.empty());
    }

    public static CodeLocation of(long blockAddr, int stmtIdx, long insAddr) {
        return new CodeLocation(Optional.of(blockAddr), Optional.of(stmtIdx), Optional.of(insAddr), Optional.empty());
    }

    public static CodeLocation ofProcedure(String procedure) {
        return new CodeLocation(Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(procedure));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeLocation)) return false;
        var that = (CodeLocation) o;
        return blockAddr.equals(that.blockAddr) && stmtIdx.equals(that.stmtIdx) && insAddr.equals(that.insAddr)
                && procedure.equals(that.procedure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockAddr, stmtIdx, insAddr, procedure);
    }

    @Override
    public String toString() {
        if (procedure.isPresent()) {
            return "<Code @ " + procedure.get() + ">";
        }
        var sb = new StringBuilder("<Code @ 0x").append(Long.toHexString(blockAddr.get()))
                .append("[").append(stmtIdx.get()).append("]");
        insAddr.ifPresent(ins -> sb.append(", ins 0x").append(Long.toHexString(ins)));
        return sb.append(">").toString();
    }
}
