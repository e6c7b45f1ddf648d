package com.tencent.netlist.domain.service;

import com.tencent.netlist.domain.builder.ComponentTreeBuilder;
import com.tencent.netlist.domain.composition.Composition;
import com.tencent.netlist.domain.resolver.ConnectionResolver;
import com.tencent.netlist.domain.resolver.ResolvedLink;
import com.tencent.netlist.domain.tree.ComponentTree;
import com.tencent.netlist.domain.tree.TieBreakPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * NetlistFlatteningService - 网表展平领域服务
 * <p>
 * 展开组合得到层级树，再解析树中所有声明的连接。每次调用构建独立的树和解析器，
 * 服务本身不持有可变状态。
 * </p>
 *
 * @author netlist
 */
@Slf4j
public class NetlistFlatteningService {

    private final ComponentTreeBuilder treeBuilder;

    private final TieBreakPolicy tieBreakPolicy;

    public NetlistFlatteningService(ComponentTreeBuilder treeBuilder, TieBreakPolicy tieBreakPolicy) {
        this.treeBuilder = treeBuilder;
        this.tieBreakPolicy = tieBreakPolicy;
    }

    /**
     * 展开并解析
     */
    public Netlist flatten(Composition composition) {
        ComponentTree tree = treeBuilder.build(composition);
        return new Netlist(tree, resolve(tree));
    }

    /**
     * 解析一棵已构建的树
     */
    public List<ResolvedLink> resolve(ComponentTree tree) {
        List<ResolvedLink> links = new ConnectionResolver(tree, tieBreakPolicy).resolveAll();
        log.info("Resolved {} links over {} nodes (tie-break: {})", links.size(), tree.size(), tieBreakPolicy);
        return links;
    }
}
