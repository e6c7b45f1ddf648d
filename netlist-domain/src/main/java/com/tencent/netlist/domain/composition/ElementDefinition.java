package com.tencent.netlist.domain.composition;

import com.tencent.netlist.domain.component.ComponentLink;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ElementDefinition - 模块中的元素定义 (未展开)
 * <p>
 * 对应编辑器画布上的一个节点。className 与某个模块同名时，该元素是那个模块的一个实例。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementDefinition {

    /**
     * 编辑器节点 ID，展开后成为 ComponentNode.type
     */
    private int id;

    /**
     * 组件类名或模块名
     */
    private String className;

    @Builder.Default
    private List<ComponentLink> links = new ArrayList<>();

    /**
     * 参数 (JSON 文本)
     */
    private String params;
}
