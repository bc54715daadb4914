package com.liftsys.ir;

import com.liftsys.ir.types.TypeCompatibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数签名：有序参数列表 + 返回类型（null 表示 void）
 */
public final class Signature {

    private final String name;
    private final List<Parameter> parameters;
    private final String returnType;

    public Signature(String name, List<Parameter> parameters, String returnType) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
        this.returnType = returnType;
    }

    public String getName() { return name; }
    public List<Parameter> getParameters() { return parameters; }
    public String getReturnType() { return returnType; }

    public boolean isVoid() {
        return TypeCompatibility.isVoid(returnType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signature)) return false;
        Signature other = (Signature) o;
        return name.equals(other.name)
                && parameters.equals(other.parameters)
                && Objects.equals(returnType, other.returnType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, returnType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i));
        }
        sb.append(')');
        if (!isVoid()) sb.append(" -> ").append(returnType);
        return sb.toString();
    }
}
