package com.tencent.netlist.domain;

import com.tencent.netlist.domain.component.ComponentLink;
import com.tencent.netlist.domain.component.ComponentNode;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * 测试用节点/连接构造工具
 */
public final class TreeFixtures {

    private TreeFixtures() {
    }

    public static ComponentNode node(String className, int type, String name, ComponentLink... links) {
        return ComponentNode.builder()
                .className(className)
                .type(type)
                .name(name)
                .parent(ComponentNode.ROOT_NAME)
                .links(new ArrayList<>(Arrays.asList(links)))
                .build();
    }

    public static ComponentLink link(String fromPort, int toNodeType, String toPort) {
        return ComponentLink.builder()
                .fromPort(fromPort)
                .toNodeType(toNodeType)
                .toPort(toPort)
                .build();
    }
}
