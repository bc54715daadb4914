package com.liftsys.compiler.verify;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 缩进结构源码（上游生成器输出的 Python 风格代码）的大纲解析器。
 *
 * <p>只做结构层面的解析：逻辑行切分（括号内换行、反斜杠续行、多行字符串）、
 * 注释剥离、按缩进还原语句树。无法解析时抛出 {@link OutlineException}：</p>
 * <ul>
 *   <li>源码为空</li>
 *   <li>括号不匹配或未闭合</li>
 *   <li>字符串未结束</li>
 *   <li>意外缩进、回退缩进与任何外层都对不齐</li>
 *   <li>复合语句头之后没有语句体</li>
 *   <li>语句不完整：以二元运算符结尾、以 {@code =} 开头、语句头缺少条件</li>
 * </ul>
 * <p>不检查表达式内部的语法，通过解析不代表源码一定能编译。</p>
 */
public final class OutlineParser {

    private static final int TAB_SIZE = 8;

    private static final String OPERATOR_CHARS = "+-*/%@&|^<>=~";
    private static final Pattern TRAILING_WORD_OPERATOR = Pattern.compile("(^|[^A-Za-z0-9_])(and|or|not|in|is)$");
    private static final Pattern STAR_IMPORT = Pattern.compile("\\bimport\\s*\\*$");

    public SourceOutline parse(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new OutlineException("源码为空", 0);
        }
        List<LogicalLine> lines = new Scanner(source).scan();
        if (lines.isEmpty()) {
            throw new OutlineException("源码中没有语句", 0);
        }
        return build(lines);
    }

    // ============ 逻辑行 ============

    private static final class LogicalLine {
        final String text;
        final int indent;
        final int line;

        LogicalLine(String text, int indent, int line) {
            this.text = text;
            this.indent = indent;
            this.line = line;
        }
    }

    private static final class Scanner {
        private final String src;
        private final int n;
        private int pos;
        private int lineNo = 1;
        private final List<LogicalLine> out = new ArrayList<>();
        private final Deque<Character> open = new ArrayDeque<>();
        private final Deque<Integer> openLines = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();

        Scanner(String src) {
            this.src = src;
            this.n = src.length();
        }

        List<LogicalLine> scan() {
            boolean lineStart = true;
            int indent = 0;
            int startLine = 0;
            while (pos < n) {
                if (lineStart) {
                    int col = 0;
                    while (pos < n && isIndentChar(src.charAt(pos))) {
                        col = src.charAt(pos) == '\t' ? (col / TAB_SIZE + 1) * TAB_SIZE : col + 1;
                        pos++;
                    }
                    if (pos >= n) break;
                    char c = src.charAt(pos);
                    if (c == '\n' || c == '\r' || c == '#') {
                        skipToNextLine();
                        continue;
                    }
                    indent = col;
                    startLine = lineNo;
                    lineStart = false;
                    continue;
                }

                char c = src.charAt(pos);
                if (c == '#') {
                    while (pos < n && src.charAt(pos) != '\n') pos++;
                } else if (c == '\\' && pos + 1 < n && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
                    pos++;
                    skipNewline();
                    text.append(' ');
                } else if (c == '\r') {
                    pos++;
                } else if (c == '\n') {
                    pos++;
                    lineNo++;
                    if (open.isEmpty()) {
                        emit(indent, startLine);
                        lineStart = true;
                    } else {
                        text.append(' ');
                    }
                } else if (c == '"' || c == '\'') {
                    scanString(c);
                } else {
                    trackBracket(c);
                    text.append(c);
                    pos++;
                }
            }
            if (!open.isEmpty()) {
                throw new OutlineException("括号 '" + open.peek() + "' 未闭合", openLines.peek());
            }
            if (!lineStart) emit(indent, startLine);
            return out;
        }

        private void emit(int indent, int startLine) {
            String t = text.toString().trim();
            text.setLength(0);
            if (!t.isEmpty()) out.add(new LogicalLine(t, indent, startLine));
        }

        private void trackBracket(char c) {
            if (c == '(' || c == '[' || c == '{') {
                open.push(c);
                openLines.push(lineNo);
            } else if (c == ')' || c == ']' || c == '}') {
                if (open.isEmpty() || open.peek() != matching(c)) {
                    throw new OutlineException("括号不匹配: '" + c + "'", lineNo);
                }
                open.pop();
                openLines.pop();
            }
        }

        private void scanString(char quote) {
            int startLine = lineNo;
            boolean triple = pos + 2 < n && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote;
            int width = triple ? 3 : 1;
            text.append(src, pos, pos + width);
            pos += width;
            while (pos < n) {
                char c = src.charAt(pos);
                if (c == '\\' && pos + 1 < n) {
                    if (src.charAt(pos + 1) == '\n') lineNo++;
                    text.append(c).append(src.charAt(pos + 1));
                    pos += 2;
                    continue;
                }
                if (c == '\n') {
                    if (!triple) throw new OutlineException("字符串未结束", startLine);
                    lineNo++;
                    text.append(' ');
                    pos++;
                    continue;
                }
                if (c == quote && (!triple || (pos + 2 < n && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote))) {
                    text.append(src, pos, pos + width);
                    pos += width;
                    return;
                }
                if (c != '\r') text.append(c);
                pos++;
            }
            throw new OutlineException("字符串未结束", startLine);
        }

        private void skipToNextLine() {
            while (pos < n && src.charAt(pos) != '\n') pos++;
            if (pos < n) {
                pos++;
                lineNo++;
            }
        }

        private void skipNewline() {
            if (pos < n && src.charAt(pos) == '\r') pos++;
            if (pos < n && src.charAt(pos) == '\n') {
                pos++;
                lineNo++;
            }
        }

        private static boolean isIndentChar(char c) {
            return c == ' ' || c == '\t' || c == '\f';
        }

        private static char matching(char close) {
            return close == ')' ? '(' : close == ']' ? '[' : '{';
        }
    }

    // ============ 语句树 ============

    private SourceOutline build(List<LogicalLine> lines) {
        List<Statement> top = new ArrayList<>();
        Deque<Integer> indents = new ArrayDeque<>();
        Deque<Statement> owners = new ArrayDeque<>();
        indents.push(0);
        Statement pendingOpener = null;

        for (LogicalLine line : lines) {
            if (pendingOpener != null) {
                if (line.indent <= indents.peek()) {
                    throw new OutlineException("'" + pendingOpener.getKind().getKeyword() + "' 之后缺少缩进的语句体",
                            line.line);
                }
                indents.push(line.indent);
                owners.push(pendingOpener);
                pendingOpener = null;
            } else if (line.indent > indents.peek()) {
                throw new OutlineException("意外的缩进", line.line);
            } else {
                while (line.indent < indents.peek()) {
                    indents.pop();
                    owners.pop();
                }
                if (line.indent != indents.peek()) {
                    throw new OutlineException("回退的缩进与任何外层都不对齐", line.line);
                }
            }

            for (Statement st : split(line)) {
                if (owners.isEmpty()) {
                    top.add(st);
                } else {
                    owners.peek().addChild(st);
                }
                if (st.getKind().isCompound() && st.getBody().isEmpty()) {
                    pendingOpener = st;
                }
            }
        }
        if (pendingOpener != null) {
            throw new OutlineException("'" + pendingOpener.getKind().getKeyword() + "' 之后缺少语句体",
                    pendingOpener.getLine());
        }
        return new SourceOutline(top);
    }

    /**
     * 把一条逻辑行拆成语句：复合语句头与同行的语句体，或以分号分隔的简单语句。
     */
    private List<Statement> split(LogicalLine line) {
        List<Statement> result = new ArrayList<>();
        StatementKind kind = StatementKind.classify(line.text);
        if (kind.isCompound()) {
            if (line.text.endsWith(":")) {
                Statement header = new Statement(kind, line.text, line.indent, line.line);
                checkHeader(header);
                result.add(header);
                return result;
            }
            int colon = topLevelIndex(line.text, ':', 0);
            if (colon < 0) {
                throw new OutlineException("'" + kind.getKeyword() + "' 语句头缺少冒号", line.line);
            }
            Statement header = new Statement(kind, line.text.substring(0, colon + 1).trim(), line.indent, line.line);
            checkHeader(header);
            for (String part : splitSimple(line.text.substring(colon + 1))) {
                header.addChild(simple(part, line.indent + 1, line.line));
            }
            result.add(header);
            return result;
        }
        for (String part : splitSimple(line.text)) {
            result.add(simple(part, line.indent, line.line));
        }
        return result;
    }

    private static Statement simple(String text, int indent, int line) {
        StatementKind kind = StatementKind.classify(text);
        if (kind.isCompound()) {
            throw new OutlineException("'" + kind.getKeyword() + "' 不能出现在同行语句体中", line);
        }
        if (text.startsWith("=") || endsWithOperator(text)) {
            throw new OutlineException("语句不完整: " + text, line);
        }
        return new Statement(kind, text, indent, line);
    }

    /** 检查语句头关键字与冒号之间的部分 */
    private static void checkHeader(Statement header) {
        String text = header.getText();
        if (text.startsWith("async ")) text = text.substring(6).trim();
        String operand = text.substring(header.getKind().getKeyword().length(), text.length() - 1).trim();
        switch (header.getKind()) {
            case ELSE:
            case TRY:
            case FINALLY:
                if (!operand.isEmpty()) {
                    throw new OutlineException("'" + header.getKind().getKeyword() + "' 之后不应有表达式",
                            header.getLine());
                }
                break;
            case EXCEPT:
                if (endsWithOperator(operand)) {
                    throw new OutlineException("语句头不完整: " + header.getText(), header.getLine());
                }
                break;
            case DEF:
            case CLASS:
                if (operand.isEmpty()) {
                    throw new OutlineException("'" + header.getKind().getKeyword() + "' 缺少名称", header.getLine());
                }
                break;
            default:
                if (operand.isEmpty() || endsWithOperator(operand)) {
                    throw new OutlineException("语句头不完整: " + header.getText(), header.getLine());
                }
                break;
        }
    }

    /** 是否以二元运算符（符号或 and/or/not/in/is）结尾；{@code import *} 除外 */
    static boolean endsWithOperator(String text) {
        String t = text.trim();
        if (t.isEmpty() || STAR_IMPORT.matcher(t).find()) return false;
        return OPERATOR_CHARS.indexOf(t.charAt(t.length() - 1)) >= 0
                || TRAILING_WORD_OPERATOR.matcher(t).find();
    }

    private static List<String> splitSimple(String text) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        while (true) {
            int semi = topLevelIndex(text, ';', from);
            String part = (semi < 0 ? text.substring(from) : text.substring(from, semi)).trim();
            if (!part.isEmpty()) parts.add(part);
            if (semi < 0) break;
            from = semi + 1;
        }
        return parts;
    }

    /** 括号与字符串之外第一次出现 target 的下标 */
    static int topLevelIndex(String text, char target, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
