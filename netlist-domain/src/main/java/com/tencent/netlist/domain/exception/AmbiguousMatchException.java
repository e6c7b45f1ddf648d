package com.tencent.netlist.domain.exception;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.tree.NodeAttribute;
import lombok.Getter;

/**
 * 同一搜索范围内有多个节点满足条件。
 * <p>
 * 仅在 {@link com.tencent.netlist.domain.tree.TieBreakPolicy#REJECT_AMBIGUOUS} 策略下抛出，
 * 默认策略按遍历顺序取第一个匹配。
 * </p>
 */
@Getter
public class AmbiguousMatchException extends NetlistResolutionException {

    private final ComponentNode first;

    private final ComponentNode second;

    public AmbiguousMatchException(NodeAttribute attribute, long value, ComponentNode first, ComponentNode second) {
        super("Ambiguous match for " + attribute + " = " + value + ": "
                + first.getName() + " and " + second.getName());
        this.first = first;
        this.second = second;
    }

    @Override
    public String getErrorCode() {
        return "AMBIGUOUS_MATCH";
    }
}
