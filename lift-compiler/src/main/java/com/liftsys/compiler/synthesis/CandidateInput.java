package com.liftsys.compiler.synthesis;

import com.liftsys.compiler.assembly.Fragment;
import com.liftsys.compiler.assembly.FunctionSkeleton;
import com.liftsys.compiler.assembly.StructureNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 上游结构生成的一份输出：结构树、片段表，以及可选的函数骨架
 */
public final class CandidateInput {

    private final FunctionSkeleton skeleton;
    private final List<StructureNode> structure;
    private final Map<String, Fragment> fragments;

    public CandidateInput(FunctionSkeleton skeleton, List<StructureNode> structure, Map<String, Fragment> fragments) {
        this.skeleton = skeleton;
        this.structure = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(structure, "structure")));
        this.fragments = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fragments, "fragments")));
    }

    public CandidateInput(StructureNode root, Map<String, Fragment> fragments) {
        this(null, Collections.singletonList(Objects.requireNonNull(root, "root")), fragments);
    }

    /** 为 null 时只组装函数体片段 */
    public FunctionSkeleton getSkeleton() { return skeleton; }
    public List<StructureNode> getStructure() { return structure; }
    public Map<String, Fragment> getFragments() { return fragments; }
}
