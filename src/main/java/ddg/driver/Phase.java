package ddg.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A phase: a named transformation from {@code In} to {@code Out}, driven by a {@link Config}.
 * <p>
 * Errors raised by {@link #transform} are fatal and propagate out of {@link #apply} unchanged.
 *
 * @param <In>  input type
 * @param <Out> output type
 */
public abstract class Phase<In, Out> {

    private static final Logger log = LoggerFactory.getLogger(Phase.class);

    public final String name;

    protected final Config config;

    public Phase(String name, Config config) {
        this.name = name;
        this.config = config;
    }

    /**
     * Transformation.
     *
     * @param input input
     * @return output
     */
    public abstract Out transform(In input);

    /**
     * Hook invoked after a successful transformation.
     *
     * @param output the result of {@link #transform}
     */
    public void onSucceed(Out output) {
    }

    /**
     * Run the transformation, then the success hook.
     *
     * @param input input
     * @return output
     */
    public Out apply(In input) {
        log.debug("phase {} started with {}", name, config);
        var output = transform(input);
        onSucceed(output);
        log.debug("phase {} finished", name);
        return output;
    }
}
