package ddg.cfg;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Control flow graph, as recovered before the dependence analysis runs. It is only read, never modified.
 */
public interface Cfg {

    Collection<CfgNode> nodes();

    List<CfgEdge> outEdges(CfgNode node);

    int inDegree(CfgNode node);

    /**
     * Were the final execution states kept on every node while building this CFG?
     */
    boolean keepsState();

    FunctionManager functionManager();

    default List<CfgNode> successors(CfgNode node) {
        return outEdges(node).stream().map(edge -> edge.dst).collect(Collectors.toList());
    }
}
