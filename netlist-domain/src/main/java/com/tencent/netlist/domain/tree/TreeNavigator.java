package com.tencent.netlist.domain.tree;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.exception.AmbiguousMatchException;
import com.tencent.netlist.domain.exception.StructuralLookupException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TreeNavigator - 层级树遍历原语
 * <p>
 * 提供父节点查找、到根路径计算、作用域内兄弟查找，供连接解析器组合使用。
 * 对树只读。
 * </p>
 */
public class TreeNavigator {

    private final ComponentTree tree;

    private final TieBreakPolicy tieBreakPolicy;

    public TreeNavigator(ComponentTree tree) {
        this(tree, TieBreakPolicy.FIRST_MATCH);
    }

    public TreeNavigator(ComponentTree tree, TieBreakPolicy tieBreakPolicy) {
        this.tree = tree;
        this.tieBreakPolicy = tieBreakPolicy;
    }

    /**
     * 查找父节点
     *
     * @throws StructuralLookupException 根哨兵没有父节点，或节点不在树中
     */
    public ComponentNode parentOf(ComponentNode node) {
        int index = tree.indexOf(node);
        int parent = tree.getParentIndex(index);
        if (parent == ComponentTree.NO_PARENT) {
            throw new StructuralLookupException("Root node " + node.getName() + " has no parent",
                    NodeAttribute.IDENTITY, node.getIdentity());
        }
        return tree.getNode(parent);
    }

    /**
     * 从节点自身开始，依次收集每个祖先的类型，直到根哨兵的类型 0。
     * <p>
     * 顺序为叶到根；解析时从末尾 (根) 开始消费。
     * </p>
     */
    public List<Integer> pathToRoot(ComponentNode node) {
        List<Integer> path = new ArrayList<>();
        int index = tree.indexOf(node);
        while (index != ComponentTree.NO_PARENT) {
            path.add(tree.getNode(index).getType());
            index = tree.getParentIndex(index);
        }
        return path;
    }

    /**
     * 在 level 及其下方查找属性值等于 value 的节点，返回节点及其所在的兄弟层级。
     * <p>
     * 按类型查找时逐层向下：先看 level 自身的成员，没有命中才进入下一层 (各成员的子节点层级，
     * 按插入顺序)，因此离 level 最近的一层优先，嵌套在前面兄弟模块里的同类型节点不会抢先命中。
     * 按 identity 查找时做深度优先先序搜索，identity 全树唯一。
     * </p>
     */
    public Optional<NodeMatch> findBy(List<Integer> level, NodeAttribute attribute, long value) {
        if (attribute == NodeAttribute.IDENTITY) {
            return Optional.ofNullable(findInSubtrees(level, attribute, value));
        }
        List<List<Integer>> frontier = List.of(level);
        while (!frontier.isEmpty()) {
            for (List<Integer> candidates : frontier) {
                Optional<NodeMatch> match = findInLevel(candidates, attribute, value);
                if (match.isPresent()) {
                    return match;
                }
            }
            List<List<Integer>> next = new ArrayList<>();
            for (List<Integer> candidates : frontier) {
                for (Integer index : candidates) {
                    if (!tree.isLeaf(index)) {
                        next.add(tree.getChildren(index));
                    }
                }
            }
            frontier = next;
        }
        return Optional.empty();
    }

    /**
     * 只在 level 自身的成员中查找，不进入任何子树。
     * <p>
     * 在 {@link TieBreakPolicy#REJECT_AMBIGUOUS} 策略下，同一层级中出现第二个匹配即抛出
     * {@link AmbiguousMatchException}；不同层级中的同值节点互不冲突。
     * </p>
     */
    public Optional<NodeMatch> findInLevel(List<Integer> level, NodeAttribute attribute, long value) {
        NodeMatch first = null;
        for (Integer index : level) {
            ComponentNode candidate = tree.getNode(index);
            if (!attribute.matches(candidate, value)) {
                continue;
            }
            if (first != null) {
                throw new AmbiguousMatchException(attribute, value, first.getNode(), candidate);
            }
            first = new NodeMatch(index, candidate, level);
            if (tieBreakPolicy == TieBreakPolicy.FIRST_MATCH) {
                break;
            }
        }
        return Optional.ofNullable(first);
    }

    /**
     * 从节点的兄弟层级开始，逐级向上扩大到各祖先的兄弟层级，返回最近的包含 targetType 的匹配。
     *
     * @throws StructuralLookupException 直到根层级仍未找到
     */
    public NodeMatch siblingScope(ComponentNode node, int targetType) {
        int index = tree.indexOf(node);
        int scopeOwner = tree.getParentIndex(index);
        while (scopeOwner != ComponentTree.NO_PARENT) {
            Optional<NodeMatch> match = findBy(tree.getChildren(scopeOwner), NodeAttribute.TYPE, targetType);
            if (match.isPresent()) {
                return match.get();
            }
            scopeOwner = tree.getParentIndex(scopeOwner);
        }
        throw StructuralLookupException.notFound(NodeAttribute.TYPE, targetType,
                "any level enclosing " + node.getName());
    }

    private NodeMatch findInSubtrees(List<Integer> level, NodeAttribute attribute, long value) {
        for (Integer index : level) {
            ComponentNode candidate = tree.getNode(index);
            if (attribute.matches(candidate, value)) {
                return new NodeMatch(index, candidate, level);
            }
            NodeMatch nested = findInSubtrees(tree.getChildren(index), attribute, value);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }
}
