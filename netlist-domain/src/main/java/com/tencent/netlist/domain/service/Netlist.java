package com.tencent.netlist.domain.service;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.resolver.ResolvedLink;
import com.tencent.netlist.domain.tree.ComponentTree;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Netlist - 展平结果
 * <p>
 * 展开后的层级树及按确定顺序排列的叶子间连接。
 * </p>
 */
@Value
public class Netlist {

    ComponentTree tree;

    List<ResolvedLink> links;

    /**
     * 所有叶子组件 (不含根哨兵)，先序
     */
    public List<ComponentNode> getLeaves() {
        List<ComponentNode> leaves = new ArrayList<>();
        for (int i = 0; i < tree.size(); i++) {
            if (i != ComponentTree.ROOT_INDEX && tree.isLeaf(i)) {
                leaves.add(tree.getNode(i));
            }
        }
        return leaves;
    }
}
