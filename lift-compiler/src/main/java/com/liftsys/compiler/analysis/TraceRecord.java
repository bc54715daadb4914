package com.liftsys.compiler.analysis;

import com.liftsys.ir.Effect;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 执行轨迹中的一条记录：某个 Effect 的模拟求值结果
 */
public final class TraceRecord {

    private final int index;
    private final Effect effect;
    private final StateDelta delta;
    private final boolean reachable;
    private final Set<String> unresolved;

    public TraceRecord(int index, Effect effect, StateDelta delta, boolean reachable, Set<String> unresolved) {
        this.index = index;
        this.effect = effect;
        this.delta = delta;
        this.reachable = reachable;
        this.unresolved = Collections.unmodifiableSet(new LinkedHashSet<>(unresolved));
    }

    /** 在 Effect 序列中的下标 */
    public int getIndex() { return index; }
    public Effect getEffect() { return effect; }
    public StateDelta getDelta() { return delta; }
    public boolean isReachable() { return reachable; }
    /** 引用了但此前从未引入的名称 */
    public Set<String> getUnresolved() { return unresolved; }

    /** Effect 位置，即问题报告使用的 location */
    public int getPosition() {
        return effect.getPosition();
    }

    @Override
    public String toString() {
        return (reachable ? "  " : "x ") + effect + "  " + delta;
    }
}
