package com.liftsys.compiler.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数骨架：导入、签名行与文档字符串，按原样输出
 */
public final class FunctionSkeleton {

    private final List<String> imports;
    private final List<String> signatureLines;
    private final List<String> docstringLines;

    public FunctionSkeleton(List<String> imports, List<String> signatureLines, List<String> docstringLines) {
        this.imports = Collections.unmodifiableList(new ArrayList<>(imports));
        this.signatureLines = Collections.unmodifiableList(new ArrayList<>(signatureLines));
        this.docstringLines = Collections.unmodifiableList(new ArrayList<>(docstringLines));
        if (this.signatureLines.isEmpty()) {
            throw new IllegalArgumentException("函数骨架至少需要一行签名");
        }
    }

    public List<String> getImports() { return imports; }
    public List<String> getSignatureLines() { return signatureLines; }
    public List<String> getDocstringLines() { return docstringLines; }
}
