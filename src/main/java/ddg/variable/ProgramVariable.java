package ddg.variable;

import java.util.Objects;

/**
 * A variable as defined or read at a specific code location.
 */
public final class ProgramVariable {

    public final Variable variable;

    public final CodeLocation location;

    public ProgramVariable(Variable variable, CodeLocation location) {
        this.variable = variable;
        this.location = location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgramVariable)) return false;
        var that = (ProgramVariable) o;
        return variable.equals(that.variable) && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, location);
    }

    @Override
    public String toString() {
        return "<" + variable + " @ " + location + ">";
    }
}
