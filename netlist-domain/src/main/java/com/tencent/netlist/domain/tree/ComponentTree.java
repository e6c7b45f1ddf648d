package com.tencent.netlist.domain.tree;

import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.exception.StructuralLookupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ComponentTree - 层级树
 * <p>
 * 以数组 (arena) 形式保存的嵌套归属结构：每个节点记录有序的子节点下标列表和父节点下标。
 * 父节点索引在构建时一次性建立，之后树不可变。下标 0 固定为根哨兵 "Home"。
 * </p>
 * <p>
 * "兄弟层级" 即某个父节点的子节点下标列表；根节点自身所在的层级为 {@link #rootLevel()}。
 * </p>
 */
public final class ComponentTree {

    public static final int ROOT_INDEX = 0;

    public static final int NO_PARENT = -1;

    private final List<ComponentNode> nodes;

    private final List<List<Integer>> children;

    private final int[] parents;

    private final Map<Long, Integer> indexByIdentity;

    private ComponentTree(Builder builder) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.nodes));
        List<List<Integer>> frozen = new ArrayList<>(builder.children.size());
        for (List<Integer> level : builder.children) {
            frozen.add(Collections.unmodifiableList(new ArrayList<>(level)));
        }
        this.children = Collections.unmodifiableList(frozen);
        this.parents = new int[builder.parents.size()];
        for (int i = 0; i < parents.length; i++) {
            parents[i] = builder.parents.get(i);
        }
        this.indexByIdentity = Collections.unmodifiableMap(new HashMap<>(builder.indexByIdentity));
    }

    public static Builder builder(ComponentNode root) {
        return new Builder(root);
    }

    public ComponentNode getRoot() {
        return nodes.get(ROOT_INDEX);
    }

    public ComponentNode getNode(int index) {
        return nodes.get(index);
    }

    /**
     * 所有节点，按插入顺序 (先序)
     */
    public List<ComponentNode> getNodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(ComponentNode node) {
        return node != null && indexByIdentity.containsKey(node.getIdentity());
    }

    /**
     * @throws StructuralLookupException 节点不属于这棵树
     */
    public int indexOf(ComponentNode node) {
        Integer index = node == null ? null : indexByIdentity.get(node.getIdentity());
        if (index == null) {
            throw new StructuralLookupException("Node " + node + " is not part of this tree",
                    NodeAttribute.IDENTITY, node == null ? 0 : node.getIdentity());
        }
        return index;
    }

    public List<Integer> getChildren(int index) {
        return children.get(index);
    }

    public List<ComponentNode> getChildNodes(ComponentNode node) {
        List<ComponentNode> result = new ArrayList<>();
        for (Integer child : children.get(indexOf(node))) {
            result.add(nodes.get(child));
        }
        return result;
    }

    /**
     * @return 父节点下标，根节点返回 {@link #NO_PARENT}
     */
    public int getParentIndex(int index) {
        return parents[index];
    }

    public boolean isLeaf(int index) {
        return children.get(index).isEmpty();
    }

    /**
     * 根节点自身所在的层级，只包含根节点
     */
    public List<Integer> rootLevel() {
        return List.of(ROOT_INDEX);
    }

    /**
     * 节点所在的兄弟层级
     */
    public List<Integer> levelOf(int index) {
        int parent = parents[index];
        return parent == NO_PARENT ? rootLevel() : children.get(parent);
    }

    public static final class Builder {

        private final List<ComponentNode> nodes = new ArrayList<>();

        private final List<List<Integer>> children = new ArrayList<>();

        private final List<Integer> parents = new ArrayList<>();

        private final Map<Long, Integer> indexByIdentity = new HashMap<>();

        private final Set<String> names = new HashSet<>();

        private Builder(ComponentNode root) {
            if (root == null || root.getType() != ComponentNode.ROOT_TYPE) {
                throw new IllegalArgumentException("Tree root must be a sentinel node of type " + ComponentNode.ROOT_TYPE);
            }
            if (root.getLinks() != null && !root.getLinks().isEmpty()) {
                throw new IllegalArgumentException("Tree root must not declare links");
            }
            append(root, NO_PARENT);
        }

        /**
         * 在 parentIndex 下追加一个子节点
         *
         * @return 新节点的下标
         */
        public int addChild(int parentIndex, ComponentNode node) {
            if (parentIndex < 0 || parentIndex >= nodes.size()) {
                throw new IllegalArgumentException("Unknown parent index: " + parentIndex);
            }
            int index = append(node, parentIndex);
            children.get(parentIndex).add(index);
            return index;
        }

        public ComponentTree build() {
            return new ComponentTree(this);
        }

        private int append(ComponentNode node, int parentIndex) {
            if (indexByIdentity.containsKey(node.getIdentity())) {
                throw new IllegalArgumentException("Node already added to tree: " + node);
            }
            if (node.getName() != null && !names.add(node.getName())) {
                throw new IllegalArgumentException("Duplicate instance name: " + node.getName());
            }
            int index = nodes.size();
            nodes.add(node);
            children.add(new ArrayList<>());
            parents.add(parentIndex);
            indexByIdentity.put(node.getIdentity(), index);
            return index;
        }
    }
}
