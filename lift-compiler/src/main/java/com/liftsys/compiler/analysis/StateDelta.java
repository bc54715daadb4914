package com.liftsys.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单个 Effect 推断出的状态变化
 */
public final class StateDelta {

    private final String binding;
    private final String bindingType;
    private final Set<String> consumed;
    private final boolean terminates;

    public StateDelta(String binding, String bindingType, Set<String> consumed, boolean terminates) {
        this.binding = binding;
        this.bindingType = bindingType;
        this.consumed = Collections.unmodifiableSet(new LinkedHashSet<>(consumed));
        this.terminates = terminates;
    }

    /** 引入的绑定名，无则为 null */
    public String getBinding() { return binding; }
    public String getBindingType() { return bindingType; }
    public Set<String> getConsumed() { return consumed; }
    /** 是否终止顶层执行路径（顶层 return） */
    public boolean isTerminates() { return terminates; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (binding != null) {
            sb.append("+").append(binding);
            if (bindingType != null) sb.append(':').append(bindingType);
            sb.append(' ');
        }
        if (!consumed.isEmpty()) sb.append("reads").append(consumed).append(' ');
        if (terminates) sb.append("END");
        return sb.toString().trim();
    }
}
