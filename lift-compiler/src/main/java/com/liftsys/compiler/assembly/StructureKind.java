package com.liftsys.compiler.assembly;

/**
 * 结构节点种类
 */
public enum StructureKind {
    /** 顺序语句块 */
    BLOCK,
    CONDITIONAL,
    LOOP
}
