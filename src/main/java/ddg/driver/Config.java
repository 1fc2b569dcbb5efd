package ddg.driver;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Options of a data dependence analysis run.
 */
public final class Config {

    /**
     * Label reaching-definition edges with the defined variable itself rather than a definition count.
     */
    public final boolean keepData;

    /**
     * How deep we track in the call tree. Empty means no limit.
     */
    public final Optional<Integer> callDepth;

    /**
     * Where to dump the statement dependence graph once the analysis succeeds, if anywhere.
     */
    public final Optional<Path> dumpPath;

    private Config(boolean keepData, Optional<Integer> callDepth, Optional<Path> dumpPath) {
        this.keepData = keepData;
        this.callDepth = callDepth;
        this.dumpPath = dumpPath;
    }

    public static Config defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Is the given call depth inside the configured bound?
     *
     * @param depth call depth
     * @return true/false
     */
    public boolean withinCallDepth(int depth) {
        return callDepth.map(bound -> 0 <= depth && depth <= bound).orElse(true);
    }

    @Override
    public String toString() {
        return "Config{keepData=" + keepData + ", callDepth=" + callDepth.map(String::valueOf).orElse("unbounded")
                + ", dumpPath=" + dumpPath.map(Path::toString).orElse("none") + "}";
    }

    public static final class Builder {

        private boolean keepData = false;

        private Integer callDepth = null;

        private Path dumpPath = null;

        private Builder() {
        }

        public Builder keepData(boolean keepData) {
            this.keepData = keepData;
            return this;
        }

        public Builder callDepth(int callDepth) {
            if (callDepth < 0) {
                throw new IllegalArgumentException("call depth must be non-negative, got " + callDepth);
            }
            this.callDepth = callDepth;
            return this;
        }

        public Builder unboundedCallDepth() {
            this.callDepth = null;
            return this;
        }

        public Builder dumpTo(Path dumpPath) {
            this.dumpPath = dumpPath;
            return this;
        }

        public Config build() {
            return new Config(keepData, Optional.ofNullable(callDepth), Optional.ofNullable(dumpPath));
        }
    }
}
