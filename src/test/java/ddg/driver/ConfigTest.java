package ddg.driver;

import org.junit.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class ConfigTest {

    @Test
    public void testDefaults() {
        var config = Config.defaults();
        assertFalse(config.keepData);
        assertThat(config.callDepth, is(Optional.empty()));
        assertThat(config.dumpPath, is(Optional.empty()));
    }

    @Test
    public void testUnboundedDepthAcceptsAnything() {
        var config = Config.defaults();
        assertTrue(config.withinCallDepth(-1));
        assertTrue(config.withinCallDepth(1000));
    }

    @Test
    public void testBoundedDepth() {
        var config = Config.builder().callDepth(2).keepData(true).dumpTo(Path.of("ddg.txt")).build();
        assertTrue(config.keepData);
        assertTrue(config.withinCallDepth(0));
        assertTrue(config.withinCallDepth(2));
        assertFalse(config.withinCallDepth(3));
        assertFalse(config.withinCallDepth(-1));
        assertThat(config.dumpPath.get(), is(Path.of("ddg.txt")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDepthRejected() {
        Config.builder().callDepth(-1);
    }
}
