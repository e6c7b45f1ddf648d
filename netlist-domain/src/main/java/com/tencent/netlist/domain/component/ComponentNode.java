package com.tencent.netlist.domain.component;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ComponentNode - 组件节点 (组件实例)
 * <p>
 * 层级树中的一个实例化组件。identity 在构造时分配且不可变，是树内结构相等性的唯一依据；
 * 其余属性为可变记录，由树构建器填充，解析器只读。
 * </p>
 * <p>
 * 相等性与哈希只基于 identity。按类名比较、按类名字符串比较、按 identity 比较
 * 分别通过 {@link #sameClassAs}, {@link #hasClassName}, {@link #isIdentity} 显式表达。
 * </p>
 */
@Getter
@Setter
@ToString(of = {"name", "className", "type"})
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ComponentNode {

    /**
     * 根哨兵节点名称
     */
    public static final String ROOT_NAME = "Home";

    /**
     * 根哨兵节点类型
     */
    public static final int ROOT_TYPE = 0;

    private static final AtomicLong IDENTITY_SEQUENCE = new AtomicLong();

    /**
     * 进程内唯一的实例标识
     */
    @EqualsAndHashCode.Include
    @Setter(AccessLevel.NONE)
    private final long identity;

    /**
     * 组件/模块模板名称 (如 "Adder")
     */
    private String className;

    /**
     * 编辑器分配的模板 ID
     * <p>
     * 在同一未展开层级的兄弟节点间唯一，同一模块的不同实例之间会重复。
     * </p>
     */
    private int type;

    /**
     * 全局唯一的实例名称 (className + "#" + 序号)
     */
    private String name;

    /**
     * 父实例名称，根哨兵为 null
     */
    private String parent;

    /**
     * 声明的 (尚未解析的) 连接
     */
    private List<ComponentLink> links;

    /**
     * 序列化后的参数 (JSON 文本)，解析过程不使用
     */
    private String params;

    @Builder
    public ComponentNode(String className, int type, String name, String parent,
                         List<ComponentLink> links, String params) {
        this.identity = IDENTITY_SEQUENCE.incrementAndGet();
        this.className = className;
        this.type = type;
        this.name = name;
        this.parent = parent;
        this.links = links != null ? links : new ArrayList<>();
        this.params = params;
    }

    /**
     * 创建根哨兵节点 "Home"
     */
    public static ComponentNode root() {
        return ComponentNode.builder()
                .className(ROOT_NAME)
                .type(ROOT_TYPE)
                .name(ROOT_NAME)
                .build();
    }

    public boolean isRoot() {
        return type == ROOT_TYPE && parent == null;
    }

    /**
     * 与另一节点是否实例化自同一模板
     */
    public boolean sameClassAs(ComponentNode other) {
        return other != null && className != null && className.equals(other.className);
    }

    public boolean hasClassName(String candidate) {
        return className != null && className.equals(candidate);
    }

    public boolean isIdentity(long candidate) {
        return identity == candidate;
    }
}
