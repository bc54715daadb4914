package com.liftsys.ir;

import java.util.Objects;

/**
 * 函数参数（名称 + 语义类型）
 */
public final class Parameter {
    private final String name;
    private final String typeHint;
    private final String description;

    public Parameter(String name, String typeHint) {
        this(name, typeHint, null);
    }

    public Parameter(String name, String typeHint, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeHint = typeHint;
        this.description = description;
    }

    public String getName() { return name; }
    public String getTypeHint() { return typeHint; }
    public String getDescription() { return description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameter)) return false;
        Parameter other = (Parameter) o;
        return name.equals(other.name)
                && Objects.equals(typeHint, other.typeHint)
                && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeHint, description);
    }

    @Override
    public String toString() {
        return typeHint != null ? name + ": " + typeHint : name;
    }
}
