package com.tencent.netlist.domain.component;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentNodeTest {

    @Test
    void testIdentityIsUniquePerInstance() {
        ComponentNode first = ComponentNode.builder().className("Adder").type(1).name("Adder#0").build();
        ComponentNode second = ComponentNode.builder().className("Adder").type(1).name("Adder#0").build();

        assertThat(first.getIdentity()).isNotEqualTo(second.getIdentity());
        assertThat(first).isNotEqualTo(second);
        assertThat(first).isEqualTo(first);
    }

    @Test
    void testEqualityAndHashFollowIdentityOnly() {
        ComponentNode node = ComponentNode.builder().className("Adder").type(1).name("Adder#0").build();
        int hashBefore = node.hashCode();

        node.setClassName("Multiplier");
        node.setName("Multiplier#0");
        node.setType(9);

        assertThat(node.hashCode()).isEqualTo(hashBefore);
        Set<ComponentNode> set = new HashSet<>();
        set.add(node);
        assertThat(set).contains(node);
    }

    @Test
    void testNamedComparisons() {
        ComponentNode adder = ComponentNode.builder().className("Adder").type(1).name("Adder#0").build();
        ComponentNode otherAdder = ComponentNode.builder().className("Adder").type(2).name("Adder#1").build();
        ComponentNode divider = ComponentNode.builder().className("Divider").type(3).name("Divider#0").build();

        assertThat(adder.sameClassAs(otherAdder)).isTrue();
        assertThat(adder.sameClassAs(divider)).isFalse();
        assertThat(adder.sameClassAs(null)).isFalse();

        assertThat(adder.hasClassName("Adder")).isTrue();
        assertThat(adder.hasClassName("Divider")).isFalse();

        assertThat(adder.isIdentity(adder.getIdentity())).isTrue();
        assertThat(adder.isIdentity(otherAdder.getIdentity())).isFalse();
    }

    @Test
    void testRootSentinel() {
        ComponentNode root = ComponentNode.root();

        assertThat(root.getName()).isEqualTo("Home");
        assertThat(root.getType()).isZero();
        assertThat(root.getParent()).isNull();
        assertThat(root.getLinks()).isEmpty();
        assertThat(root.isRoot()).isTrue();
    }

    @Test
    void testLinksDefaultToEmptyList() {
        ComponentNode node = ComponentNode.builder().className("Adder").type(1).build();

        assertThat(node.getLinks()).isNotNull().isEmpty();
        assertThat(node.isRoot()).isFalse();
    }
}
