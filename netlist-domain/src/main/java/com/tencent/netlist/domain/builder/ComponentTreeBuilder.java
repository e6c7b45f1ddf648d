package com.tencent.netlist.domain.builder;

import com.tencent.netlist.domain.component.ComponentLink;
import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.composition.Composition;
import com.tencent.netlist.domain.composition.ElementDefinition;
import com.tencent.netlist.domain.tree.ComponentTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * ComponentTreeBuilder - 层级树构建器
 * <p>
 * 从 "Home" 模块开始按声明顺序实例化元素；元素的类名若是另一个模块，则递归展开该模块，
 * 其元素成为当前实例的子节点。每个实例都获得新的 identity 和全局唯一名称。
 * </p>
 *
 * @author netlist
 */
@Slf4j
public class ComponentTreeBuilder {

    public ComponentTree build(Composition composition) {
        List<ElementDefinition> home = composition.getModule(Composition.HOME_MODULE)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Composition has no " + Composition.HOME_MODULE + " module"));

        ComponentNode root = ComponentNode.root();
        ComponentTree.Builder tree = ComponentTree.builder(root);
        Deque<String> expanding = new ArrayDeque<>();
        expanding.push(Composition.HOME_MODULE);

        instantiate(composition, home, ComponentTree.ROOT_INDEX, root, tree, new NameRegistry(), expanding);

        ComponentTree built = tree.build();
        log.info("Built component tree with {} nodes from {} modules", built.size(), composition.getModules().size());
        return built;
    }

    private void instantiate(Composition composition, List<ElementDefinition> elements, int parentIndex,
                             ComponentNode parent, ComponentTree.Builder tree, NameRegistry names,
                             Deque<String> expanding) {
        for (ElementDefinition element : elements) {
            ComponentNode node = ComponentNode.builder()
                    .className(element.getClassName())
                    .type(element.getId())
                    .name(names.nextName(element.getClassName()))
                    .parent(parent.getName())
                    .links(copyLinks(element.getLinks()))
                    .params(element.getParams())
                    .build();
            int index = tree.addChild(parentIndex, node);

            if (composition.isModule(element.getClassName())) {
                if (expanding.contains(element.getClassName())) {
                    throw new IllegalStateException("Cyclic module instantiation: " + element.getClassName()
                            + " is instantiated inside itself via " + expanding);
                }
                expanding.push(element.getClassName());
                instantiate(composition, composition.getModules().get(element.getClassName()),
                        index, node, tree, names, expanding);
                expanding.pop();
            }
        }
    }

    private List<ComponentLink> copyLinks(List<ComponentLink> links) {
        List<ComponentLink> copies = new ArrayList<>();
        if (links != null) {
            for (ComponentLink link : links) {
                copies.add(new ComponentLink(link.getFromPort(), link.getToNodeType(), link.getToPort()));
            }
        }
        return copies;
    }
}
