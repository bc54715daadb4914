package com.liftsys.compiler.analysis;

import com.liftsys.ir.BranchPath;
import com.liftsys.ir.Effect;
import com.liftsys.ir.EffectKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 由 branch_id 还原出的块结构树。
 *
 * <p>第一个命名某个尚未出现的块的 LOOP/CONDITIONAL Effect 是该块的开头，
 * 它本身位于父作用域；之后同 id 的 Effect 是块成员。先于开头被引用的块
 * 视为隐式块（kind 为 {@link BlockKind#IMPLICIT}）。</p>
 */
public final class BranchStructure {

    public enum BlockKind {
        LOOP, CONDITIONAL, IMPLICIT
    }

    /** 结构树节点：单个 Effect 或一个块 */
    public static final class Item {
        private final Effect effect;
        private final Block block;

        private Item(Effect effect, Block block) {
            this.effect = effect;
            this.block = block;
        }

        public boolean isBlock() { return block != null; }
        public Effect getEffect() { return effect; }
        public Block getBlock() { return block; }
    }

    /** 循环或条件块 */
    public static final class Block {
        private final String key;
        private final BlockKind kind;
        private final Effect opener;
        private final int position;
        private final List<Item> thenArm = new ArrayList<>();
        private final List<Item> elseArm = new ArrayList<>();

        private Block(String key, BlockKind kind, Effect opener, int position) {
            this.key = key;
            this.kind = kind;
            this.opener = opener;
            this.position = position;
        }

        public String getKey() { return key; }
        public BlockKind getKind() { return kind; }
        /** 开头 Effect；隐式块为 null */
        public Effect getOpener() { return opener; }
        /** 开头的位置；隐式块取第一个成员的位置 */
        public int getPosition() { return position; }
        public List<Item> getThenArm() { return Collections.unmodifiableList(thenArm); }
        public List<Item> getElseArm() { return Collections.unmodifiableList(elseArm); }

        public boolean hasElse() {
            return !elseArm.isEmpty();
        }

        /** 块内（含嵌套块）的所有成员 Effect，按出现顺序 */
        public List<Effect> members() {
            List<Effect> result = new ArrayList<>();
            collect(thenArm, result);
            collect(elseArm, result);
            return result;
        }

        public boolean containsReturn() {
            for (Effect e : members()) {
                if (e.getKind() == EffectKind.RETURN) return true;
            }
            return false;
        }

        public boolean contains(Effect effect) {
            return members().contains(effect);
        }
    }

    private final List<Item> topLevel = new ArrayList<>();
    private final Map<String, Block> blocks = new LinkedHashMap<>();

    private BranchStructure() {
    }

    public static BranchStructure of(List<Effect> effects) {
        BranchStructure s = new BranchStructure();
        for (Effect e : effects) {
            s.place(e);
        }
        return s;
    }

    private void place(Effect e) {
        BranchPath path = e.getBranchPath();
        if (!path.isTopLevel() && e.getKind().isBlockOpener() && !path.isElseArm()
                && !blocks.containsKey(path.blockKey())) {
            List<Item> container = containerFor(path.parent(), e.getPosition());
            BlockKind kind = e.getKind() == EffectKind.LOOP ? BlockKind.LOOP : BlockKind.CONDITIONAL;
            Block block = new Block(path.blockKey(), kind, e, e.getPosition());
            blocks.put(block.key, block);
            container.add(new Item(null, block));
            return;
        }
        containerFor(path, e.getPosition()).add(new Item(e, null));
    }

    private List<Item> containerFor(BranchPath path, int position) {
        List<Item> container = topLevel;
        List<BranchPath.Segment> segments = path.getSegments();
        for (int i = 1; i <= segments.size(); i++) {
            String key = path.blockKey(i);
            Block block = blocks.get(key);
            if (block == null) {
                block = new Block(key, BlockKind.IMPLICIT, null, position);
                blocks.put(key, block);
                container.add(new Item(null, block));
            }
            container = segments.get(i - 1).isElseArm() ? block.elseArm : block.thenArm;
        }
        return container;
    }

    public List<Item> getTopLevel() {
        return Collections.unmodifiableList(topLevel);
    }

    /** 所有块，按出现顺序 */
    public List<Block> getBlocks() {
        return new ArrayList<>(blocks.values());
    }

    public List<Block> getLoops() {
        List<Block> loops = new ArrayList<>();
        for (Block b : blocks.values()) {
            if (b.kind == BlockKind.LOOP) loops.add(b);
        }
        return loops;
    }

    public Block getBlock(String key) {
        return blocks.get(key);
    }

    /** 顶层序列是否在所有路径上都返回 */
    public boolean alwaysReturns() {
        return alwaysReturns(topLevel);
    }

    /**
     * 序列包含 return，或包含一个 then/else 两臂都必然返回的条件块。
     * 循环可能一次都不执行，从不计入。
     */
    public static boolean alwaysReturns(List<Item> sequence) {
        for (Item item : sequence) {
            if (!item.isBlock()) {
                if (item.effect.getKind() == EffectKind.RETURN) return true;
                continue;
            }
            Block b = item.block;
            if (b.kind != BlockKind.LOOP && b.hasElse()
                    && alwaysReturns(b.thenArm) && alwaysReturns(b.elseArm)) {
                return true;
            }
        }
        return false;
    }

    private static void collect(List<Item> items, List<Effect> out) {
        for (Item item : items) {
            if (item.isBlock()) {
                Block b = item.block;
                if (b.opener != null) out.add(b.opener);
                collect(b.thenArm, out);
                collect(b.elseArm, out);
            } else {
                out.add(item.effect);
            }
        }
    }
}
