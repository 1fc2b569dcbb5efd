package ddg.lowlevel.action;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An expression consumed by an action: its size and the registers and temporaries it was computed from.
 */
public final class Operand {

    public final int size;

    public final Set<Integer> regDeps;

    public final Set<Integer> tmpDeps;

    public Operand(int size, Set<Integer> regDeps, Set<Integer> tmpDeps) {
        this.size = size;
        this.regDeps = Collections.unmodifiableSet(new LinkedHashSet<>(regDeps));
        this.tmpDeps = Collections.unmodifiableSet(new LinkedHashSet<>(tmpDeps));
    }

    public static Operand of(int size) {
        return new Operand(size, Set.of(), Set.of());
    }

    @Override
    public String toString() {
        return "Operand{size=" + size + ", regDeps=" + regDeps + ", tmpDeps=" + tmpDeps + "}";
    }
}
