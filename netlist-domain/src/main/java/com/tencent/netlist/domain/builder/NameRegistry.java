package com.tencent.netlist.domain.builder;

import java.util.HashMap;
import java.util.Map;

/**
 * NameRegistry - 实例命名上下文
 * <p>
 * 记录每个类名已出现的次数，生成 "Adder#0", "Adder#1" 这样的全局唯一实例名。
 * 每次构建创建一个新实例并显式传递。
 * </p>
 */
public class NameRegistry {

    public static final String NAME_DELIMITER = "#";

    private final Map<String, Integer> occurrences = new HashMap<>();

    public String nextName(String className) {
        int ordinal = occurrences.merge(className, 1, Integer::sum) - 1;
        return className + NAME_DELIMITER + ordinal;
    }

    public int occurrencesOf(String className) {
        return occurrences.getOrDefault(className, 0);
    }
}
