package com.tencent.netlist.domain.resolver;

import com.tencent.netlist.domain.component.ComponentNode;
import lombok.Value;

/**
 * 一侧已解析的端点：具体节点 + 端口名
 */
@Value
public class ResolvedEndpoint {

    ComponentNode node;

    String port;
}
