package ddg.driver.error;

/**
 * Fatal error of the data dependence analysis. Once raised, no partial result is produced.
 */
public abstract class DdgError extends RuntimeException {

    protected abstract String getErrMsg();

    @Override
    public String getMessage() {
        return "*** Error: " + getErrMsg();
    }
}
