package com.tencent.netlist.domain.resolver;

import com.tencent.netlist.domain.component.ComponentNode;
import lombok.Value;

/**
 * ResolvedLink - 已解析的连接
 * <p>
 * 两端都是具体节点和端口，不再含有类型路径。由解析器创建，交给渲染器消费，创建后不可变。
 * </p>
 */
@Value
public class ResolvedLink {

    ComponentNode fromNode;

    String fromPort;

    ComponentNode toNode;

    String toPort;

    public static ResolvedLink of(ResolvedEndpoint from, ResolvedEndpoint to) {
        return new ResolvedLink(from.getNode(), from.getPort(), to.getNode(), to.getPort());
    }

    @Override
    public String toString() {
        return "(" + fromNode.getName() + ", " + fromPort + ") -> (" + toNode.getName() + ", " + toPort + ")";
    }
}
