package com.liftsys.compiler.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 结构树节点：由上游结构生成步骤给出，携带种类与嵌套深度。
 * 节点代码通过 id 在片段表中查找。
 */
public final class StructureNode {

    private final String id;
    private final StructureKind kind;
    private final int depth;
    private final List<StructureNode> children;

    public StructureNode(String id, StructureKind kind, int depth, List<StructureNode> children) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.depth = depth;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static StructureNode leaf(String id, int depth) {
        return new StructureNode(id, StructureKind.BLOCK, depth, Collections.<StructureNode>emptyList());
    }

    public static StructureNode of(String id, StructureKind kind, int depth, StructureNode... children) {
        return new StructureNode(id, kind, depth, Arrays.asList(children));
    }

    public String getId() { return id; }
    public StructureKind getKind() { return kind; }
    public int getDepth() { return depth; }
    public List<StructureNode> getChildren() { return children; }

    @Override
    public String toString() {
        return kind + "(" + id + ", depth=" + depth + ", children=" + children.size() + ")";
    }
}
