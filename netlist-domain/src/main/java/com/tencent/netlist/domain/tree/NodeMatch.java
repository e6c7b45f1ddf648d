package com.tencent.netlist.domain.tree;

import com.tencent.netlist.domain.component.ComponentNode;
import lombok.Value;

import java.util.List;

/**
 * 查找结果：命中的节点、其在树中的下标，以及它所在的兄弟层级 (父节点的子节点下标列表)。
 */
@Value
public class NodeMatch {

    int index;

    ComponentNode node;

    List<Integer> containingLevel;
}
