package ddg.backend.dataflow;

import ddg.variable.CodeLocation;
import ddg.variable.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reaching definitions: for each variable, the code locations that may have defined its current value.
 * <p>
 * Inside a node a write kills every previous definition of the variable. Across nodes, definitions flowing in from
 * different predecessors accumulate (see {@link #mergeFrom}).
 */
public final class LiveDefs {

    private static final Logger log = LoggerFactory.getLogger(LiveDefs.class);

    private final HashMap<Variable, LinkedHashSet<CodeLocation>> defs = new HashMap<>();

    public LiveDefs() {
    }

    /**
     * @return a deep copy, sharing no sets with this one
     */
    public LiveDefs copy() {
        var copy = new LiveDefs();
        defs.forEach((variable, locs) -> copy.defs.put(variable, new LinkedHashSet<>(locs)));
        return copy;
    }

    /**
     * @param variable variable
     * @return locations defining {@code variable}, empty if none
     */
    public Set<CodeLocation> lookup(Variable variable) {
        var locs = defs.get(variable);
        return locs == null ? Set.of() : Collections.unmodifiableSet(locs);
    }

    public boolean isDefined(Variable variable) {
        return defs.containsKey(variable);
    }

    /**
     * Record that {@code loc} defines {@code variable}, dropping all its previous definitions.
     * <p>
     * Only exact matches are killed. Overlapping but unequal memory cells or registers keep their definitions.
     *
     * @param variable variable
     * @param loc      defining location
     */
    public void kill(Variable variable, CodeLocation loc) {
        var locs = new LinkedHashSet<CodeLocation>();
        locs.add(loc);
        defs.put(variable, locs);
    }

    /**
     * Union every definition of {@code other} into this store.
     *
     * @param other incoming definitions
     * @return true if anything was added
     */
    public boolean mergeFrom(LiveDefs other) {
        var changed = false;
        for (var entry : other.defs.entrySet()) {
            var variable = entry.getKey();
            var locs = defs.get(variable);
            if (locs == null) {
                log.debug("new var {}", variable);
                defs.put(variable, new LinkedHashSet<>(entry.getValue()));
                changed = true;
                continue;
            }
            for (var loc : entry.getValue()) {
                if (locs.add(loc)) {
                    log.debug("new code location {} for {}", loc, variable);
                    changed = true;
                }
            }
        }
        return changed;
    }

    public int size() {
        return defs.size();
    }

    @Override
    public String toString() {
        return defs.toString();
    }
}
