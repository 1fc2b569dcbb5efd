package ddg.testing;

import ddg.cfg.Cfg;
import ddg.cfg.CfgEdge;
import ddg.cfg.CfgNode;
import ddg.cfg.Function;
import ddg.cfg.FunctionManager;
import ddg.lowlevel.JumpKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

public class FakeCfg implements Cfg {

    private final LinkedHashMap<CfgNode, List<CfgEdge>> outEdges = new LinkedHashMap<>();

    private final List<Function> functions = new ArrayList<>();

    private boolean keepsState = true;

    public FakeCfg node(CfgNode node) {
        outEdges.putIfAbsent(node, new ArrayList<>());
        return this;
    }

    public FakeCfg edge(CfgNode src, CfgNode dst) {
        return edge(src, dst, JumpKind.ORDINARY);
    }

    public FakeCfg edge(CfgNode src, CfgNode dst, JumpKind jumpKind) {
        node(src);
        node(dst);
        outEdges.get(src).add(new CfgEdge(src, dst, jumpKind));
        return this;
    }

    public FakeCfg functions(Function... functions) {
        this.functions.addAll(Arrays.asList(functions));
        return this;
    }

    public FakeCfg withoutState() {
        keepsState = false;
        return this;
    }

    @Override
    public Collection<CfgNode> nodes() {
        return outEdges.keySet();
    }

    @Override
    public List<CfgEdge> outEdges(CfgNode node) {
        return outEdges.getOrDefault(node, List.of());
    }

    @Override
    public int inDegree(CfgNode node) {
        var degree = 0;
        for (var edges : outEdges.values()) {
            for (var edge : edges) {
                if (edge.dst.equals(node)) {
                    degree++;
                }
            }
        }
        return degree;
    }

    @Override
    public boolean keepsState() {
        return keepsState;
    }

    @Override
    public FunctionManager functionManager() {
        return () -> functions;
    }
}
