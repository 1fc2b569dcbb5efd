package ddg.lowlevel.action;

import ddg.variable.CodeLocation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * An event recorded by the execution engine: a read or write of a register, a memory cell or a temporary, or the
 * evaluation of an exit condition.
 * <p>
 * Every action knows the code location it happened at. Use {@link Visitor} to process actions by kind.
 */
public abstract class Action {

    public enum Op {
        READ, WRITE
    }

    public final Op op;

    public final CodeLocation location;

    protected Action(Op op, CodeLocation location) {
        this.op = op;
        this.location = location;
    }

    public boolean isRead() {
        return op == Op.READ;
    }

    public abstract void accept(Visitor v);

    private static Set<Integer> frozen(Set<Integer> deps) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(deps));
    }

    public interface Visitor {

        void visitReg(Reg action);

        void visitMem(Mem action);

        void visitTmp(Tmp action);

        void visitExit(Exit action);
    }

    /**
     * Register access.
     */
    public static class Reg extends Action {

        public final int offset;

        public final int size;

        public final Set<Integer> regDeps;

        public final Set<Integer> tmpDeps;

        public Reg(Op op, CodeLocation location, int offset, int size, Set<Integer> regDeps, Set<Integer> tmpDeps) {
            super(op, location);
            this.offset = offset;
            this.size = size;
            this.regDeps = frozen(regDeps);
            this.tmpDeps = frozen(tmpDeps);
        }

        @Override
        public void accept(Visitor v) {
            v.visitReg(this);
        }

        @Override
        public String toString() {
            return "reg/" + op.name().toLowerCase() + " " + offset + " @ " + location;
        }
    }

    /**
     * Memory access.
     */
    public static class Mem extends Action {

        /**
         * Addresses the engine actually touched, if it reported them.
         */
        public final Optional<Set<Long>> actualAddrs;

        public final Operand addr;

        public final Operand data;

        public Mem(Op op, CodeLocation location, Optional<Set<Long>> actualAddrs, Operand addr, Operand data) {
            super(op, location);
            this.actualAddrs = actualAddrs.map(addrs -> Collections.unmodifiableSet(new LinkedHashSet<>(addrs)));
            this.addr = addr;
            this.data = data;
        }

        @Override
        public void accept(Visitor v) {
            v.visitMem(this);
        }

        @Override
        public String toString() {
            return "mem/" + op.name().toLowerCase() + " @ " + location;
        }
    }

    /**
     * Temporary access.
     */
    public static class Tmp extends Action {

        public final int tmp;

        public final Set<Integer> tmpDeps;

        public Tmp(Op op, CodeLocation location, int tmp, Set<Integer> tmpDeps) {
            super(op, location);
            this.tmp = tmp;
            this.tmpDeps = frozen(tmpDeps);
        }

        @Override
        public void accept(Visitor v) {
            v.visitTmp(this);
        }

        @Override
        public String toString() {
            return "tmp/" + op.name().toLowerCase() + " t" + tmp + " @ " + location;
        }
    }

    /**
     * Evaluation of a branch condition. Exits only depend on temporaries.
     */
    public static class Exit extends Action {

        public final Set<Integer> tmpDeps;

        public Exit(CodeLocation location, Set<Integer> tmpDeps) {
            super(Op.READ, location);
            this.tmpDeps = frozen(tmpDeps);
        }

        @Override
        public void accept(Visitor v) {
            v.visitExit(this);
        }

        @Override
        public String toString() {
            return "exit " + tmpDeps + " @ " + location;
        }
    }
}
