package com.liftsys.compiler.verify;

import com.liftsys.ir.IntermediateRepresentation;
import com.liftsys.ir.constraint.Constraint;
import com.liftsys.ir.constraint.ConstraintFilter;
import com.liftsys.ir.constraint.ConstraintVisitor;
import com.liftsys.ir.constraint.LoopBehaviorConstraint;
import com.liftsys.ir.constraint.PositionConstraint;
import com.liftsys.ir.constraint.PositionRelation;
import com.liftsys.ir.constraint.ReturnConstraint;
import com.liftsys.ir.constraint.TypeConstraint;
import com.liftsys.ir.types.TypeCompatibility;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 约束校验器：检查生成的源码是否保留了 IR 声明的约束。
 *
 * <p>尽力而为的结构扫描，不做完整的控制流证明。从不抛出异常：
 * 无法解析的源码得到 compiles=false 且所有约束失败；
 * 单项检查的意外故障记为该约束失败。</p>
 */
public final class ConstraintVerifier {

    private static final Logger LOG = Logger.getLogger(ConstraintVerifier.class.getName());

    private final OutlineParser parser;

    public ConstraintVerifier() {
        this(new OutlineParser());
    }

    public ConstraintVerifier(OutlineParser parser) {
        this.parser = parser;
    }

    /**
     * 只校验对该 IR 适用的约束（见 {@link ConstraintFilter}），
     * 报告与评分都不计入不适用的约束。
     */
    public VerificationReport verify(String source, IntermediateRepresentation ir) {
        return verify(source, ConstraintFilter.applicable(ir));
    }

    public VerificationReport verify(String source, List<Constraint> constraints) {
        List<ConstraintResult> results = new ArrayList<>();
        SourceOutline outline;
        try {
            outline = parser.parse(source);
        } catch (OutlineException e) {
            LOG.fine("源码无法解析: " + e.getMessage());
            for (Constraint c : constraints) {
                results.add(ConstraintResult.fail(c, "源码无法解析"));
            }
            return new VerificationReport(false, results, e.getMessage());
        }

        Context ctx = new Context(outline, earlyReturnDeclared(constraints));
        for (Constraint c : constraints) {
            try {
                results.add(c.accept(CHECKER, ctx));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "约束检查失败: " + c, e);
                results.add(ConstraintResult.fail(c, "检查过程出错: " + e.getMessage()));
            }
        }
        return new VerificationReport(true, results, null);
    }

    private static boolean earlyReturnDeclared(List<Constraint> constraints) {
        for (Constraint c : constraints) {
            if (c instanceof LoopBehaviorConstraint && ((LoopBehaviorConstraint) c).requiresEarlyReturn()) {
                return true;
            }
        }
        return false;
    }

    /** 单次校验共享的只读上下文 */
    private static final class Context {
        final SourceOutline outline;
        final List<Statement> body;
        final List<Statement> flat;
        final boolean earlyReturnDeclared;

        Context(SourceOutline outline, boolean earlyReturnDeclared) {
            this.outline = outline;
            this.body = outline.functionBody();
            this.flat = SourceOutline.flatten(body);
            this.earlyReturnDeclared = earlyReturnDeclared;
        }
    }

    private static final ConstraintVisitor<ConstraintResult, Context> CHECKER = new ConstraintVisitor<ConstraintResult, Context>() {

        @Override
        public ConstraintResult visitReturn(ReturnConstraint c, Context ctx) {
            if (!c.isMustReturn()) {
                return ConstraintResult.pass(c, "未要求返回值");
            }
            if (pathsReturn(ctx.body, ctx.earlyReturnDeclared)) {
                return ConstraintResult.pass(c, "所有路径都返回值");
            }
            return ConstraintResult.fail(c, "存在不返回值的执行路径");
        }

        @Override
        public ConstraintResult visitLoopBehavior(LoopBehaviorConstraint c, Context ctx) {
            List<Statement> loops = new ArrayList<>();
            for (Statement s : ctx.flat) {
                if (s.getKind().isLoop()) loops.add(s);
            }
            if (loops.isEmpty()) {
                return ConstraintResult.fail(c, "未找到循环");
            }

            if (c.requiresEarlyReturn()) {
                for (Statement loop : loops) {
                    List<Statement> returns = returnsIn(loop);
                    if (returns.isEmpty()) continue;
                    if (!anyValueReturn(returns)) {
                        return ConstraintResult.pass(c, "循环在第 " + loop.getLine() + " 行内提前返回");
                    }
                    if (hasFallbackAfter(ctx.flat, loop)) {
                        return ConstraintResult.pass(c, "循环内提前返回，循环后有兜底返回");
                    }
                    return ConstraintResult.fail(c, "循环内提前返回，但循环结束后没有兜底返回");
                }
                return ConstraintResult.fail(c, "循环内没有 return，无法命中即返回");
            }

            for (Statement loop : loops) {
                if (!returnsIn(loop).isEmpty()) {
                    return ConstraintResult.fail(c, c.getPattern() + " 要求完整遍历，但第 "
                            + loop.getLine() + " 行的循环内存在 return");
                }
            }
            int lastLoopEnd = 0;
            for (Statement loop : loops) {
                lastLoopEnd = Math.max(lastLoopEnd, loop.getEndLine());
            }
            boolean anyValue = false;
            for (Statement s : ctx.flat) {
                if (!s.isValueReturn()) continue;
                anyValue = true;
                if (s.getLine() > lastLoopEnd) {
                    return ConstraintResult.pass(c, "循环结束后返回");
                }
            }
            return anyValue
                    ? ConstraintResult.fail(c, "返回值没有位于循环结束之后")
                    : ConstraintResult.pass(c, "完整遍历，无返回值");
        }

        @Override
        public ConstraintResult visitPosition(PositionConstraint c, Context ctx) {
            List<Integer> first = indicesMentioning(ctx.flat, c.getFirst());
            List<Integer> second = indicesMentioning(ctx.flat, c.getSecond());
            if (first.isEmpty() || second.isEmpty()) {
                return ConstraintResult.fail(c, "代码中找不到 '" + (first.isEmpty() ? c.getFirst() : c.getSecond()) + "'");
            }
            int distance = Integer.MAX_VALUE;
            for (int i : first) {
                for (int j : second) {
                    distance = Math.min(distance, Math.abs(i - j));
                }
            }
            boolean adjacent = distance <= 1;
            boolean passed = c.getRelation() == PositionRelation.ADJACENT ? adjacent : !adjacent;
            return new ConstraintResult(c, passed, "'" + c.getFirst() + "' 与 '" + c.getSecond()
                    + "' 相距 " + distance + " 条语句");
        }

        @Override
        public ConstraintResult visitType(TypeConstraint c, Context ctx) {
            String annotation = ctx.outline.getReturnAnnotation();
            if (annotation != null) {
                boolean ok = TypeCompatibility.isCompatible(c.getExpectedType(), annotation);
                return new ConstraintResult(c, ok, "返回注解 " + annotation + (ok ? " 兼容 " : " 不兼容 ")
                        + c.getExpectedType());
            }
            boolean returnsValue = false;
            for (Statement s : ctx.flat) {
                if (s.isValueReturn()) {
                    returnsValue = true;
                    break;
                }
            }
            boolean expectsValue = !TypeCompatibility.isVoid(c.getExpectedType());
            return new ConstraintResult(c, returnsValue == expectsValue,
                    "无返回注解，" + (returnsValue ? "函数返回值" : "函数不返回值"));
        }
    };

    // ============ 路径分析 ============

    /**
     * 语句序列是否在每条路径上以带值 return 或 raise 结束。
     *
     * @param loopReturnCounts 循环体内的带值 return 是否算作满足的路径（声明了命中即返回时）
     */
    static boolean pathsReturn(List<Statement> seq, boolean loopReturnCounts) {
        for (int i = 0; i < seq.size(); i++) {
            Statement s = seq.get(i);
            switch (s.getKind()) {
                case RETURN:
                    // 裸 return 结束了路径但没有返回值
                    return s.isValueReturn();
                case RAISE:
                    return true;
                case IF: {
                    boolean allArms = pathsReturn(s.getBody(), loopReturnCounts);
                    boolean hasElse = false;
                    int j = i + 1;
                    for (; j < seq.size(); j++) {
                        Statement arm = seq.get(j);
                        if (arm.getKind() == StatementKind.ELIF) {
                            allArms &= pathsReturn(arm.getBody(), loopReturnCounts);
                        } else if (arm.getKind() == StatementKind.ELSE) {
                            allArms &= pathsReturn(arm.getBody(), loopReturnCounts);
                            hasElse = true;
                            j++;
                            break;
                        } else {
                            break;
                        }
                    }
                    if (hasElse && allArms) return true;
                    i = j - 1;
                    break;
                }
                case TRY: {
                    boolean bodyOk = pathsReturn(s.getBody(), loopReturnCounts);
                    boolean handlersOk = true;
                    boolean elseOk = false;
                    int j = i + 1;
                    for (; j < seq.size(); j++) {
                        Statement arm = seq.get(j);
                        if (arm.getKind() == StatementKind.EXCEPT) {
                            handlersOk &= pathsReturn(arm.getBody(), loopReturnCounts);
                        } else if (arm.getKind() == StatementKind.ELSE) {
                            elseOk = pathsReturn(arm.getBody(), loopReturnCounts);
                        } else if (arm.getKind() == StatementKind.FINALLY) {
                            if (pathsReturn(arm.getBody(), loopReturnCounts)) return true;
                        } else {
                            break;
                        }
                    }
                    if ((bodyOk || elseOk) && handlersOk) return true;
                    i = j - 1;
                    break;
                }
                case WITH:
                    if (pathsReturn(s.getBody(), loopReturnCounts)) return true;
                    break;
                case FOR:
                case WHILE:
                    if (loopReturnCounts && anyValueReturn(returnsIn(s))) return true;
                    if (isInfiniteLoop(s) && anyValueReturn(returnsIn(s)) && !hasBreak(s)) return true;
                    break;
                default:
                    break;
            }
        }
        return false;
    }

    private static boolean isInfiniteLoop(Statement loop) {
        String header = loop.getText().replace(" ", "");
        return "whileTrue:".equals(header) || "while1:".equals(header);
    }

    private static boolean hasBreak(Statement loop) {
        for (Statement s : loop.subtree()) {
            if (s.getKind() == StatementKind.BREAK) return true;
        }
        return false;
    }

    /** 循环子树中的 return（不含嵌套函数） */
    private static List<Statement> returnsIn(Statement loop) {
        List<Statement> returns = new ArrayList<>();
        for (Statement s : loop.subtree()) {
            if (s.getKind() == StatementKind.RETURN) returns.add(s);
        }
        return returns;
    }

    private static boolean anyValueReturn(List<Statement> returns) {
        for (Statement r : returns) {
            if (r.isValueReturn()) return true;
        }
        return false;
    }

    /** 循环结束之后、且不在任何循环内的 return（可不带值）或 raise */
    private static boolean hasFallbackAfter(List<Statement> flat, Statement loop) {
        List<Statement> inLoops = new ArrayList<>();
        for (Statement s : flat) {
            if (s.getKind().isLoop()) inLoops.addAll(s.subtree());
        }
        for (Statement s : flat) {
            if (s.getLine() <= loop.getEndLine() || containsIdentity(inLoops, s)) continue;
            if (s.getKind() == StatementKind.RETURN || s.getKind() == StatementKind.RAISE) return true;
        }
        return false;
    }

    private static boolean containsIdentity(List<Statement> list, Statement target) {
        for (Statement s : list) {
            if (s == target) return true;
        }
        return false;
    }

    private static List<Integer> indicesMentioning(List<Statement> flat, String subject) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < flat.size(); i++) {
            if (flat.get(i).getText().contains(subject)) result.add(i);
        }
        return result;
    }
}
