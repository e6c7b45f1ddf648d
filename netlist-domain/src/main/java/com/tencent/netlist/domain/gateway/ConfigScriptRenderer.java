package com.tencent.netlist.domain.gateway;

import com.tencent.netlist.domain.resolver.ResolvedLink;
import com.tencent.netlist.domain.tree.ComponentTree;

import java.util.List;

/**
 * ConfigScriptRenderer - 配置脚本渲染网关
 * <p>
 * 把层级树中的叶子组件和已解析的连接序列化为目标仿真配置脚本。
 * 负责生成唯一的连接标识。实现位于基础设施层。
 * </p>
 */
public interface ConfigScriptRenderer {

    /**
     * 渲染配置脚本
     * @param tree 层级树 (提供叶子组件及其参数)
     * @param links 已解析的连接，按解析顺序
     * @return 脚本文本
     */
    String render(ComponentTree tree, List<ResolvedLink> links);
}
