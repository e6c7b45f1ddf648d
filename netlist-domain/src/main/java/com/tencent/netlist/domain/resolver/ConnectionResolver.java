package com.tencent.netlist.domain.resolver;

import com.tencent.netlist.domain.component.ComponentLink;
import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.exception.NetlistResolutionException;
import com.tencent.netlist.domain.exception.StructuralLookupException;
import com.tencent.netlist.domain.tree.ComponentTree;
import com.tencent.netlist.domain.tree.NodeAttribute;
import com.tencent.netlist.domain.tree.NodeMatch;
import com.tencent.netlist.domain.tree.TieBreakPolicy;
import com.tencent.netlist.domain.tree.TreeNavigator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ConnectionResolver - 连接解析器
 * <p>
 * 把节点上声明的符号连接 (端口名 + 类型路径) 解析为叶子到叶子的具体连接。
 * 对树只读，无状态，单次解析结果只取决于树的内容和遍历顺序。
 * </p>
 * <p>
 * 解析规则:
 * <ul>
 *     <li>出端 (from): 路径为空时就是声明节点本身；否则把节点到根的类型路径拼在连接串路径之后，
 *     从根层级开始下降。</li>
 *     <li>入端 (to): 先用兄弟作用域逐级向上找到 toNodeType 对应的节点；路径为空时就是该节点，
 *     否则从该节点的子节点开始下降。</li>
 *     <li>下降的每一步只匹配当前层级的成员，不会越过层级匹配到别的模块实例内部。</li>
 *     <li>下降过程中一旦到达没有子节点的节点就立即返回，即使路径还没有消费完。</li>
 * </ul>
 * </p>
 */
@Slf4j
public class ConnectionResolver {

    private final ComponentTree tree;

    private final TreeNavigator navigator;

    public ConnectionResolver(ComponentTree tree) {
        this(tree, TieBreakPolicy.FIRST_MATCH);
    }

    public ConnectionResolver(ComponentTree tree, TieBreakPolicy tieBreakPolicy) {
        this.tree = tree;
        this.navigator = new TreeNavigator(tree, tieBreakPolicy);
    }

    public static ConnectionEndpoint parseEndpoint(String connection) {
        return ConnectionEndpoint.parse(connection);
    }

    /**
     * 从 typePath 末尾开始逐个消费类型：只在当前层级的成员中找该类型的节点，再进入它的子节点层级。
     *
     * @param typePath      类型路径，末尾对应最外层
     * @param startingLevel 起始层级 (兄弟节点下标列表)
     * @return 第一个到达的叶子节点
     * @throws StructuralLookupException 某一步找不到节点，或路径耗尽时停在非叶子节点上
     */
    public ComponentNode resolveDescent(List<Integer> typePath, List<Integer> startingLevel) {
        if (typePath.isEmpty()) {
            throw new StructuralLookupException("Cannot descend along an empty type path");
        }
        List<Integer> level = startingLevel;
        ComponentNode current = null;
        for (int i = typePath.size() - 1; i >= 0; i--) {
            int type = typePath.get(i);
            NodeMatch match = navigator.findInLevel(level, NodeAttribute.TYPE, type)
                    .orElseThrow(() -> StructuralLookupException.notFound(NodeAttribute.TYPE, type,
                            "type path " + typePath));
            if (tree.isLeaf(match.getIndex())) {
                if (i > 0) {
                    log.debug("Type path {} truncated at leaf {}", typePath, match.getNode().getName());
                }
                return match.getNode();
            }
            current = match.getNode();
            level = tree.getChildren(match.getIndex());
        }
        throw new StructuralLookupException("Type path " + typePath + " ends on non-leaf node " + current.getName());
    }

    /**
     * 解析出端
     */
    public ResolvedEndpoint resolveFrom(ComponentNode node, String connection) {
        ConnectionEndpoint endpoint = parseEndpoint(connection);
        if (endpoint.isDirect()) {
            return new ResolvedEndpoint(node, endpoint.getPortName());
        }
        List<Integer> path = new ArrayList<>(endpoint.getTypePath());
        path.addAll(navigator.pathToRoot(node));
        return new ResolvedEndpoint(resolveDescent(path, tree.rootLevel()), endpoint.getPortName());
    }

    /**
     * 解析入端
     */
    public ResolvedEndpoint resolveTo(ComponentNode node, int destinationType, String connection) {
        ConnectionEndpoint endpoint = parseEndpoint(connection);
        NodeMatch destination = navigator.siblingScope(node, destinationType);
        if (endpoint.isDirect() || tree.isLeaf(destination.getIndex())) {
            return new ResolvedEndpoint(destination.getNode(), endpoint.getPortName());
        }
        ComponentNode target = resolveDescent(endpoint.getTypePath(), tree.getChildren(destination.getIndex()));
        return new ResolvedEndpoint(target, endpoint.getPortName());
    }

    /**
     * 先序遍历整棵树，按节点顺序 × 连接声明顺序输出所有已解析连接。
     *
     * @throws NetlistResolutionException 任意连接解析失败，异常中带有出错节点和连接
     */
    public List<ResolvedLink> resolveAll() {
        List<ResolvedLink> resolved = new ArrayList<>();
        resolveSubtree(ComponentTree.ROOT_INDEX, resolved);
        return Collections.unmodifiableList(resolved);
    }

    private void resolveSubtree(int index, List<ResolvedLink> resolved) {
        ComponentNode node = tree.getNode(index);
        for (ComponentLink link : node.getLinks()) {
            try {
                ResolvedEndpoint from = resolveFrom(node, link.getFromPort());
                ResolvedEndpoint to = resolveTo(node, link.getToNodeType(), link.getToPort());
                ResolvedLink resolvedLink = ResolvedLink.of(from, to);
                log.debug("Resolved link {} of {} to {}", link.describe(), node.getName(), resolvedLink);
                resolved.add(resolvedLink);
            } catch (NetlistResolutionException e) {
                throw e.withContext(node.getName(), link.describe());
            }
        }
        for (Integer child : tree.getChildren(index)) {
            resolveSubtree(child, resolved);
        }
    }
}
