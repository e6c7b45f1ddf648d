package com.tencent.netlist.domain.composition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Composition - 未展开的组合
 * <p>
 * 模块名到元素定义列表的有序映射，由编辑器导出数据解析得到。"Home" 模块是最顶层。
 * </p>
 */
@Value
@Builder
public class Composition {

    public static final String HOME_MODULE = "Home";

    @Singular
    Map<String, List<ElementDefinition>> modules;

    public Optional<List<ElementDefinition>> getModule(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    public boolean isModule(String className) {
        return className != null && modules.containsKey(className);
    }
}
