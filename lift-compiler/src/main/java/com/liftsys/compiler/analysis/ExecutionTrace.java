package com.liftsys.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行轨迹：每个 Effect 一条记录，按序排列。每次解释调用构建一次，此后只读。
 */
public final class ExecutionTrace {

    private final List<TraceRecord> records;
    private final Map<String, SymbolicValue> values;
    private final SymbolicValue returnValue;

    public ExecutionTrace(List<TraceRecord> records, Map<String, SymbolicValue> values, SymbolicValue returnValue) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.returnValue = returnValue;
    }

    public List<TraceRecord> getRecords() { return records; }

    /** 链末尾已知的符号值（参数 + 计算出的绑定），按引入顺序 */
    public Map<String, SymbolicValue> getValues() { return values; }

    /** 返回值符号；链上没有携带值的可达 return 时为 null */
    public SymbolicValue getReturnValue() { return returnValue; }

    public int size() {
        return records.size();
    }

    public TraceRecord get(int index) {
        return records.get(index);
    }

    /** 所有不可达记录 */
    public List<TraceRecord> getUnreachable() {
        List<TraceRecord> result = new ArrayList<>();
        for (TraceRecord r : records) {
            if (!r.isReachable()) result.add(r);
        }
        return result;
    }

    /** 多行文本转储，供 LIFT_DUMP_TRACE 使用 */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        for (TraceRecord r : records) {
            sb.append(r).append('\n');
        }
        sb.append("values: ").append(values.values());
        if (returnValue != null) sb.append("\nreturns: ").append(returnValue);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ExecutionTrace{" + records.size() + " records}";
    }
}
