package com.tencent.netlist.domain.builder;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.composition.Composition;
import com.tencent.netlist.domain.tree.ComponentTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.tencent.netlist.domain.CompositionFixtures.element;
import static com.tencent.netlist.domain.CompositionFixtures.pipeline;
import static com.tencent.netlist.domain.CompositionFixtures.twoPipes;
import static com.tencent.netlist.domain.TreeFixtures.link;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentTreeBuilderTest {

    private final ComponentTreeBuilder builder = new ComponentTreeBuilder();

    @Test
    void testExpandsModulesInDeclarationOrder() {
        ComponentTree tree = builder.build(pipeline());

        assertThat(tree.getNodes()).extracting(ComponentNode::getName)
                .containsExactly("Home", "Source#0", "Pipe#0", "Adder#0", "Adder#1", "Sink#0");
        assertThat(tree.getRoot().isRoot()).isTrue();

        ComponentNode pipe = tree.getNode(2);
        assertThat(tree.getChildNodes(pipe)).extracting(ComponentNode::getType).containsExactly(5, 6);
        assertThat(tree.getChildNodes(pipe)).extracting(ComponentNode::getParent).containsOnly("Pipe#0");
        assertThat(tree.getNode(1).getParent()).isEqualTo("Home");
    }

    @Test
    void testEachInstanceGetsFreshNodes() {
        ComponentTree tree = builder.build(twoPipes());

        assertThat(tree.getNodes()).extracting(ComponentNode::getName)
                .containsExactly("Home", "Pipe#0", "Adder#0", "Adder#1", "Pipe#1", "Adder#2", "Adder#3");
        ComponentNode firstAdder = tree.getNode(2);
        ComponentNode thirdAdder = tree.getNode(5);
        assertThat(firstAdder.getType()).isEqualTo(thirdAdder.getType());
        assertThat(firstAdder.sameClassAs(thirdAdder)).isTrue();
        assertThat(firstAdder).isNotEqualTo(thirdAdder);
        // 连接是各实例独立的副本
        assertThat(firstAdder.getLinks()).isNotSameAs(thirdAdder.getLinks());
        assertThat(firstAdder.getLinks().get(0)).isEqualTo(thirdAdder.getLinks().get(0));
        assertThat(firstAdder.getLinks().get(0)).isNotSameAs(thirdAdder.getLinks().get(0));
    }

    @Test
    void testNamesAreCountedPerBuild() {
        ComponentTree first = builder.build(pipeline());
        ComponentTree second = builder.build(pipeline());

        assertThat(second.getNodes()).extracting(ComponentNode::getName)
                .containsExactlyElementsOf(first.getNodes().stream().map(ComponentNode::getName).collect(Collectors.toList()));
    }

    @Test
    void testMissingHomeModule() {
        Composition composition = Composition.builder()
                .module("Pipe", List.of(element(5, "Adder")))
                .build();

        assertThatThrownBy(() -> builder.build(composition))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Home");
    }

    @Test
    void testCyclicModuleInstantiationIsRejected() {
        Composition composition = Composition.builder()
                .module(Composition.HOME_MODULE, List.of(element(1, "Loop")))
                .module("Loop", List.of(element(2, "Inner")))
                .module("Inner", List.of(element(3, "Loop", link("out", 2, "in"))))
                .build();

        assertThatThrownBy(() -> builder.build(composition))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Loop");
    }

    @Test
    void testNameRegistryCountsPerClass() {
        NameRegistry names = new NameRegistry();

        assertThat(names.nextName("Adder")).isEqualTo("Adder#0");
        assertThat(names.nextName("Divider")).isEqualTo("Divider#0");
        assertThat(names.nextName("Adder")).isEqualTo("Adder#1");
        assertThat(names.occurrencesOf("Adder")).isEqualTo(2);
        assertThat(names.occurrencesOf("Negator")).isZero();
    }
}
