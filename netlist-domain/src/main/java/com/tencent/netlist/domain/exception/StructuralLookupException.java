package com.tencent.netlist.domain.exception;

import com.tencent.netlist.domain.tree.NodeAttribute;
import lombok.Getter;

/**
 * 在搜索范围内找不到所需节点 (按类型或 identity)，包括向上搜索越过根节点。
 * 说明源图的结构配置有误。
 */
@Getter
public class StructuralLookupException extends NetlistResolutionException {

    private final NodeAttribute attribute;

    private final Long value;

    public StructuralLookupException(String message) {
        super(message);
        this.attribute = null;
        this.value = null;
    }

    public StructuralLookupException(String message, NodeAttribute attribute, long value) {
        super(message + " (" + attribute + " = " + value + ")");
        this.attribute = attribute;
        this.value = value;
    }

    public static StructuralLookupException notFound(NodeAttribute attribute, long value, String scope) {
        return new StructuralLookupException("No node found in scope of " + scope, attribute, value);
    }

    @Override
    public String getErrorCode() {
        return "STRUCTURAL_LOOKUP_FAILURE";
    }
}
