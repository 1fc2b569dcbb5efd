package ddg.driver.error;

import ddg.variable.Variable;

public class UnknownVariableKindError extends DdgError {

    private final Variable variable;

    public UnknownVariableKindError(Variable variable) {
        this.variable = variable;
    }

    @Override
    protected String getErrMsg() {
        return "unknown variable kind " + variable.getClass().getSimpleName() + " of '" + variable + "'";
    }
}
