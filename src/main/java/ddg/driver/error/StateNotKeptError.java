package ddg.driver.error;

public class StateNotKeptError extends DdgError {

    @Override
    protected String getErrMsg() {
        return "CFG must be built with execution states kept on every node";
    }
}
