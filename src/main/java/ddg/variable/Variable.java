package ddg.variable;

/**
 * A storage location whose value flows between program points.
 * <p>
 * Variables are immutable; equality is structural.
 */
public abstract class Variable {

    public boolean isRegister() {
        return false;
    }

    public boolean isMemory() {
        return false;
    }

    public boolean isTemporary() {
        return false;
    }

    /**
     * A register, identified by its offset in the register file and its size in bytes.
     */
    public static final class Register extends Variable {

        public final int offset;

        public final int size;

        public Register(int offset, int size) {
            this.offset = offset;
            this.size = size;
        }

        @Override
        public boolean isRegister() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Register)) return false;
            var that = (Register) o;
            return offset == that.offset && size == that.size;
        }

        @Override
        public int hashCode() {
            return 31 * offset + size;
        }

        @Override
        public String toString() {
            return "reg_" + offset + "<" + size + ">";
        }
    }

    /**
     * A memory cell, identified by its address and its size.
     */
    public static final class Memory extends Variable {

        /**
         * Stands in for every memory access whose address cannot be resolved concretely.
         */
        public static final long SENTINEL_ADDRESS = 0x60000000L;

        public final long address;

        public final int size;

        public Memory(long address, int size) {
            this.address = address;
            this.size = size;
        }

        @Override
        public boolean isMemory() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Memory)) return false;
            var that = (Memory) o;
            return address == that.address && size == that.size;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(address) + size;
        }

        @Override
        public String toString() {
            return "mem_" + Long.toHexString(address) + "<" + size + ">";
        }
    }

    /**
     * A temporary, only meaningful inside the execution trace of a single CFG node.
     */
    public static final class Temporary extends Variable {

        public final int id;

        public Temporary(int id) {
            this.id = id;
        }

        @Override
        public boolean isTemporary() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Temporary)) return false;
            return id == ((Temporary) o).id;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(id);
        }

        @Override
        public String toString() {
            return "tmp_" + id;
        }
    }

    /**
     * The source of every immediate load. There is only one.
     */
    public static final class Constant extends Variable {

        public static final Constant INSTANCE = new Constant();

        private Constant() {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant;
        }

        @Override
        public int hashCode() {
            return Constant.class.hashCode();
        }

        @Override
        public String toString() {
            return "const";
        }
    }
}
