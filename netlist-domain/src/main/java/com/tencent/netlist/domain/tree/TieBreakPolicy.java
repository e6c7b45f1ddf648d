package com.tencent.netlist.domain.tree;

/**
 * TieBreakPolicy - 多重匹配处理策略
 * <p>
 * 类型在兄弟节点间应当唯一，但源图并不保证这一点。
 * </p>
 */
public enum TieBreakPolicy {

    /**
     * 按深度优先先序遍历顺序取第一个匹配 (文档顺序决定结果)
     */
    FIRST_MATCH,

    /**
     * 搜索范围内出现第二个匹配时抛出 AmbiguousMatchException
     */
    REJECT_AMBIGUOUS
}
