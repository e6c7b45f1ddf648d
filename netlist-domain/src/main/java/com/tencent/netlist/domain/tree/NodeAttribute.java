package com.tencent.netlist.domain.tree;

import com.tencent.netlist.domain.component.ComponentNode;

/**
 * 节点查找时可比较的属性
 */
public enum NodeAttribute {

    TYPE {
        @Override
        public long valueOf(ComponentNode node) {
            return node.getType();
        }
    },

    IDENTITY {
        @Override
        public long valueOf(ComponentNode node) {
            return node.getIdentity();
        }
    };

    public abstract long valueOf(ComponentNode node);

    public boolean matches(ComponentNode node, long value) {
        return valueOf(node) == value;
    }
}
