package com.tencent.netlist.domain.tree;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.exception.StructuralLookupException;
import org.junit.jupiter.api.Test;

import static com.tencent.netlist.domain.TreeFixtures.link;
import static com.tencent.netlist.domain.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComponentTreeTest {

    @Test
    void testParentIndexAndLevels() {
        ComponentNode module = node("Pipe", 1, "Pipe#0");
        ComponentNode inner = node("Adder", 2, "Adder#0");
        ComponentNode sibling = node("Sink", 3, "Sink#0");

        ComponentTree.Builder builder = ComponentTree.builder(ComponentNode.root());
        int moduleIndex = builder.addChild(ComponentTree.ROOT_INDEX, module);
        int innerIndex = builder.addChild(moduleIndex, inner);
        int siblingIndex = builder.addChild(ComponentTree.ROOT_INDEX, sibling);
        ComponentTree tree = builder.build();

        assertThat(tree.size()).isEqualTo(4);
        assertThat(tree.getParentIndex(ComponentTree.ROOT_INDEX)).isEqualTo(ComponentTree.NO_PARENT);
        assertThat(tree.getParentIndex(innerIndex)).isEqualTo(moduleIndex);
        assertThat(tree.getChildren(ComponentTree.ROOT_INDEX)).containsExactly(moduleIndex, siblingIndex);
        assertThat(tree.levelOf(innerIndex)).containsExactly(innerIndex);
        assertThat(tree.levelOf(ComponentTree.ROOT_INDEX)).containsExactly(ComponentTree.ROOT_INDEX);
        assertThat(tree.isLeaf(innerIndex)).isTrue();
        assertThat(tree.isLeaf(moduleIndex)).isFalse();
        assertThat(tree.getChildNodes(module)).containsExactly(inner);
        assertThat(tree.indexOf(sibling)).isEqualTo(siblingIndex);
    }

    @Test
    void testTreeIsImmutableAfterBuild() {
        ComponentTree.Builder builder = ComponentTree.builder(ComponentNode.root());
        builder.addChild(ComponentTree.ROOT_INDEX, node("Adder", 1, "Adder#0"));
        ComponentTree tree = builder.build();

        assertThatThrownBy(() -> tree.getChildren(ComponentTree.ROOT_INDEX).add(5))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> tree.getNodes().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testRejectsInvalidRoot() {
        assertThatThrownBy(() -> ComponentTree.builder(node("Adder", 1, "Adder#0")))
                .isInstanceOf(IllegalArgumentException.class);

        ComponentNode rootWithLinks = ComponentNode.root();
        rootWithLinks.getLinks().add(link("out", 1, "in"));
        assertThatThrownBy(() -> ComponentTree.builder(rootWithLinks))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("links");
    }

    @Test
    void testRejectsDuplicateNamesAndNodes() {
        ComponentNode adder = node("Adder", 1, "Adder#0");
        ComponentTree.Builder builder = ComponentTree.builder(ComponentNode.root());
        builder.addChild(ComponentTree.ROOT_INDEX, adder);

        assertThatThrownBy(() -> builder.addChild(ComponentTree.ROOT_INDEX, adder))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addChild(ComponentTree.ROOT_INDEX, node("Adder", 2, "Adder#0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Adder#0");
        assertThatThrownBy(() -> builder.addChild(42, node("Adder", 3, "Adder#1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIndexOfForeignNodeFails() {
        ComponentTree tree = ComponentTree.builder(ComponentNode.root()).build();

        assertThatThrownBy(() -> tree.indexOf(node("Adder", 1, "Adder#0")))
                .isInstanceOf(StructuralLookupException.class);
    }
}
