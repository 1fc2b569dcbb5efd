package ddg.cfg;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

public interface FunctionManager {

    Collection<Function> functions();

    /**
     * Map every known block start address to the function owning it.
     *
     * @return block address to function
     */
    default Map<Long, Function> blockIndex() {
        var index = new HashMap<Long, Function>();
        for (var func : functions()) {
            for (var block : func.blocks()) {
                index.put(block, func);
            }
        }
        return index;
    }
}
