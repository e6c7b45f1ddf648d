package com.tencent.netlist.domain.component;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ComponentLink - 声明的连接
 * <p>
 * 编辑器中从当前节点某个输出端口画出的有向连线。端口名可以携带类型路径，
 * 例如 "out#3#7"，此时连接指向嵌套模块内部的某个叶子组件。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentLink {

    /**
     * 当前节点的输出连接串
     */
    private String fromPort;

    /**
     * 目标节点的类型 (编辑器节点 ID)
     */
    private int toNodeType;

    /**
     * 目标节点的输入连接串
     */
    private String toPort;

    public String describe() {
        return fromPort + " -> " + toNodeType + ":" + toPort;
    }
}
