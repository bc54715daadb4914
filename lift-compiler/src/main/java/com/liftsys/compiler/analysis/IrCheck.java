package com.liftsys.compiler.analysis;

import com.liftsys.ir.IntermediateRepresentation;

import java.util.List;

/**
 * IR 检查接口。由 {@link IrInterpreter} 按注册顺序依次执行。
 */
public interface IrCheck {

    /** 检查名称（用于日志） */
    String getName();

    /**
     * 对 IR 执行检查。
     *
     * @param ir    待检查的 IR
     * @param trace 本次解释调用构建的执行轨迹
     * @return 发现的问题；无问题时返回空列表
     */
    List<SemanticIssue> run(IntermediateRepresentation ir, ExecutionTrace trace);
}
