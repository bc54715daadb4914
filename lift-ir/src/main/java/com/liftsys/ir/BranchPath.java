package com.liftsys.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分支路径：Effect 的 branch_id 解析结果。
 *
 * <p>语法：以 {@code /} 分隔的段表示嵌套（{@code L1/C2} 是 L1 内的 C2），
 * 段尾的 {@code :else} 表示该条件的 else 分支（{@code C2:else}）。
 * 空路径表示函数顶层。</p>
 */
public final class BranchPath {

    public static final BranchPath TOP_LEVEL = new BranchPath(Collections.<Segment>emptyList());

    private static final String ELSE_SUFFIX = ":else";

    /** 路径中的一段 */
    public static final class Segment {
        private final String id;
        private final boolean elseArm;

        Segment(String id, boolean elseArm) {
            this.id = id;
            this.elseArm = elseArm;
        }

        public String getId() { return id; }
        public boolean isElseArm() { return elseArm; }

        @Override
        public String toString() {
            return elseArm ? id + ELSE_SUFFIX : id;
        }
    }

    private final List<Segment> segments;

    private BranchPath(List<Segment> segments) {
        this.segments = segments;
    }

    /**
     * 解析 branch_id；null 或空白视为顶层。
     *
     * @throws IllegalArgumentException 存在空段（如 {@code L1//C2}）
     */
    public static BranchPath parse(String branchId) {
        if (branchId == null || branchId.trim().isEmpty()) return TOP_LEVEL;
        String[] parts = branchId.trim().split("/", -1);
        List<Segment> segments = new ArrayList<Segment>(parts.length);
        for (String raw : parts) {
            String part = raw.trim();
            boolean elseArm = false;
            if (part.endsWith(ELSE_SUFFIX)) {
                elseArm = true;
                part = part.substring(0, part.length() - ELSE_SUFFIX.length()).trim();
            }
            if (part.isEmpty()) {
                throw new IllegalArgumentException("非法的 branch_id: '" + branchId + "'");
            }
            segments.add(new Segment(part, elseArm));
        }
        return new BranchPath(Collections.unmodifiableList(segments));
    }

    public List<Segment> getSegments() { return segments; }

    public boolean isTopLevel() { return segments.isEmpty(); }

    public int depth() { return segments.size(); }

    /** 最内层段是否位于 else 分支 */
    public boolean isElseArm() {
        return !segments.isEmpty() && segments.get(segments.size() - 1).isElseArm();
    }

    /**
     * 前 {@code count} 段组成的作用域标识（不含 else 后缀），
     * 即这些段所指的循环/条件本身。
     */
    public String blockKey(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) sb.append('/');
            Segment s = segments.get(i);
            // 外层段保留分支臂，最后一段只取条件/循环本身
            sb.append(i == count - 1 ? s.getId() : s.toString());
        }
        return sb.toString();
    }

    /** 整条路径所指的块标识 */
    public String blockKey() {
        return blockKey(segments.size());
    }

    /**
     * 作用域标识（含分支臂）：then 与 else 是两个不同作用域。
     */
    public String scopeKey() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append('/');
            sb.append(segments.get(i));
        }
        return sb.toString();
    }

    /** 去掉最内层段后的父路径 */
    public BranchPath parent() {
        if (segments.isEmpty()) return this;
        return new BranchPath(segments.subList(0, segments.size() - 1));
    }

    /**
     * 判断作用域 {@code outer} 是否为 {@code inner} 的祖先或自身。
     * 顶层作用域（空串）是所有作用域的祖先。
     */
    public static boolean encloses(String outer, String inner) {
        if (outer.isEmpty()) return true;
        return inner.equals(outer) || inner.startsWith(outer + "/");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchPath)) return false;
        return scopeKey().equals(((BranchPath) o).scopeKey());
    }

    @Override
    public int hashCode() {
        return scopeKey().hashCode();
    }

    @Override
    public String toString() {
        return isTopLevel() ? "<top>" : scopeKey();
    }
}
