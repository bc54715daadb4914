package com.liftsys.compiler.assembly;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 代码组装引擎：把结构树与逐节点的代码片段合并为最终源码。
 *
 * <p>确定性单遍、无回溯。每个节点的基础缩进只由树深度决定
 * ({@code depth * 单位缩进})：</p>
 * <ul>
 *   <li>多行片段视为已自带缩进：每个非空行原样加上基础缩进，空行输出为空</li>
 *   <li>单行片段输出 {@code 基础缩进 + trim(code)}</li>
 *   <li>空片段或片段表中没有的节点不输出任何内容</li>
 * </ul>
 * <p>不根据行尾的块开头符号推断额外缩进，否则会对自带结构的片段重复缩进。</p>
 */
public final class CodeAssembler {

    private final AssemblyConfig config;

    public CodeAssembler() {
        this(new AssemblyConfig());
    }

    public CodeAssembler(AssemblyConfig config) {
        this.config = config;
    }

    public AssemblyConfig getConfig() {
        return config;
    }

    public String assemble(StructureNode root, Map<String, Fragment> fragments) {
        if (root == null) {
            throw new AssemblyException("结构树为空", null);
        }
        return assemble(Collections.singletonList(root), fragments);
    }

    /** 组装按树序排列的多个顶层节点 */
    public String assemble(List<StructureNode> roots, Map<String, Fragment> fragments) {
        AssemblyContext ctx = new AssemblyContext(config);
        renderAll(ctx, roots, fragments, 0);
        return ctx.getOutput();
    }

    /**
     * 组装完整函数：导入、空行、签名、文档字符串，然后是深度整体加一的函数体。
     */
    public String assembleFunction(FunctionSkeleton skeleton, List<StructureNode> body, Map<String, Fragment> fragments) {
        if (skeleton == null) {
            throw new AssemblyException("函数骨架为空", null);
        }
        AssemblyContext ctx = new AssemblyContext(config);
        for (String imp : skeleton.getImports()) {
            ctx.line(imp);
        }
        if (!skeleton.getImports().isEmpty()) {
            ctx.blankLine();
        }
        for (String sig : skeleton.getSignatureLines()) {
            ctx.line(sig);
        }
        for (String doc : skeleton.getDocstringLines()) {
            ctx.line(doc);
        }
        int before = ctx.lineCount();
        renderAll(ctx, body, fragments, 1);
        if (ctx.lineCount() == before && skeleton.getDocstringLines().isEmpty()) {
            ctx.line(ctx.indentFor(1) + config.getEmptyBodyPlaceholder());
        }
        return ctx.getOutput();
    }

    public String assembleFunction(FunctionSkeleton skeleton, StructureNode body, Map<String, Fragment> fragments) {
        if (body == null) {
            throw new AssemblyException("结构树为空", null);
        }
        return assembleFunction(skeleton, Collections.singletonList(body), fragments);
    }

    private void renderAll(AssemblyContext ctx, List<StructureNode> nodes, Map<String, Fragment> fragments, int offset) {
        if (nodes == null) {
            throw new AssemblyException("结构树为空", null);
        }
        if (fragments == null) {
            throw new AssemblyException("片段表为空", null);
        }
        for (StructureNode node : nodes) {
            render(ctx, node, fragments, offset, -1);
        }
    }

    private void render(AssemblyContext ctx, StructureNode node, Map<String, Fragment> fragments,
                        int offset, int parentDepth) {
        if (node == null) {
            throw new AssemblyException("结构树中存在空节点", null);
        }
        if (node.getDepth() < 0) {
            throw new AssemblyException("节点深度为负: " + node.getDepth(), node.getId());
        }
        if (parentDepth >= 0 && node.getDepth() <= parentDepth) {
            throw new AssemblyException("子节点深度 " + node.getDepth() + " 不大于父节点深度 " + parentDepth,
                    node.getId());
        }

        Fragment fragment = fragments.get(node.getId());
        if (fragment != null) {
            emit(ctx, fragment, ctx.indentFor(node.getDepth() + offset));
        }
        for (StructureNode child : node.getChildren()) {
            render(ctx, child, fragments, offset, node.getDepth());
        }
    }

    private void emit(AssemblyContext ctx, Fragment fragment, String base) {
        String code = stripTrailing(fragment.getCode());
        if (code.trim().isEmpty()) return;

        if (config.isEmitRationale() && fragment.hasRationale()) {
            for (String line : fragment.getRationale().trim().split("\\r?\\n")) {
                if (!line.trim().isEmpty()) {
                    ctx.line(base + config.getCommentPrefix() + " " + line.trim());
                }
            }
        }

        String[] lines = code.split("\\r?\\n");
        int first = 0;
        while (lines[first].trim().isEmpty()) first++;
        if (first == lines.length - 1) {
            ctx.line(base + lines[first].trim());
            return;
        }
        // 自带缩进的多行片段：只加基础缩进，保留内部相对缩进
        for (int i = first; i < lines.length; i++) {
            String line = stripTrailing(lines[i]);
            if (line.isEmpty()) {
                ctx.blankLine();
            } else {
                ctx.line(base + line);
            }
        }
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }
}
