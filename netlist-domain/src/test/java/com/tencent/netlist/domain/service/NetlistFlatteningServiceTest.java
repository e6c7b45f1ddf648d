package com.tencent.netlist.domain.service;

import com.tencent.netlist.domain.builder.ComponentTreeBuilder;
import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.resolver.ResolvedLink;
import com.tencent.netlist.domain.tree.TieBreakPolicy;
import org.junit.jupiter.api.Test;

import static com.tencent.netlist.domain.CompositionFixtures.pipeline;
import static com.tencent.netlist.domain.CompositionFixtures.twoPipes;
import static org.assertj.core.api.Assertions.assertThat;

class NetlistFlatteningServiceTest {

    private final NetlistFlatteningService service =
            new NetlistFlatteningService(new ComponentTreeBuilder(), TieBreakPolicy.REJECT_AMBIGUOUS);

    @Test
    void testFlattenPipeline() {
        Netlist netlist = service.flatten(pipeline());

        assertThat(netlist.getLinks()).extracting(ResolvedLink::toString).containsExactly(
                "(Source#0, out) -> (Adder#0, in)",
                "(Adder#1, out) -> (Sink#0, in)",
                "(Adder#0, out) -> (Adder#1, in)");
        assertThat(netlist.getLeaves()).extracting(ComponentNode::getName)
                .containsExactly("Source#0", "Adder#0", "Adder#1", "Sink#0");
    }

    @Test
    void testFlattenKeepsModuleInstancesApart() {
        Netlist netlist = service.flatten(twoPipes());

        assertThat(netlist.getLinks()).extracting(ResolvedLink::toString).containsExactly(
                "(Adder#0, out) -> (Adder#1, in)",
                "(Adder#2, out) -> (Adder#3, in)");
    }

    @Test
    void testEveryResolvedEndpointIsLeaf() {
        Netlist netlist = service.flatten(pipeline());

        for (ResolvedLink link : netlist.getLinks()) {
            assertThat(netlist.getLeaves()).contains(link.getFromNode(), link.getToNode());
        }
    }
}
