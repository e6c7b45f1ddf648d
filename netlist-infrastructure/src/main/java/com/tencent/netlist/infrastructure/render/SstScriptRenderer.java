package com.tencent.netlist.infrastructure.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tencent.netlist.domain.component.ComponentNode;
import com.tencent.netlist.domain.gateway.ConfigScriptRenderer;
import com.tencent.netlist.domain.resolver.ResolvedLink;
import com.tencent.netlist.domain.tree.ComponentTree;
import com.tencent.netlist.infrastructure.config.NetlistProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SstScriptRenderer - SST Python 配置脚本渲染器
 * <p>
 * 每个叶子组件生成一个 {@code sst.Component}，每条已解析连接生成一个 {@code sst.Link}，
 * 连接标识按顺序编号 (link_0, link_1, ...)。模块实例本身不是 SST 组件，不会输出。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SstScriptRenderer implements ConfigScriptRenderer {

    private static final String LINK_PREFIX = "link_";

    private final NetlistProperties properties;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String render(ComponentTree tree, List<ResolvedLink> links) {
        NetlistProperties.Render config = properties.getRender();
        StringBuilder script = new StringBuilder();
        script.append("import sst\n\n");
        script.append("LINK_DELAY = ").append(quote(config.getLinkDelay())).append("\n\n");

        // 1. 叶子组件
        script.append("# Components\n");
        Map<ComponentNode, String> variables = new HashMap<>();
        Set<String> usedVariables = new HashSet<>();
        for (int i = 0; i < tree.size(); i++) {
            if (i == ComponentTree.ROOT_INDEX || !tree.isLeaf(i)) {
                continue;
            }
            ComponentNode node = tree.getNode(i);
            String variable = variableName(node.getName(), usedVariables);
            variables.put(node, variable);
            script.append(variable).append(" = sst.Component(")
                    .append(quote(node.getName())).append(", ")
                    .append(quote(componentType(node, config))).append(")\n");
            String params = renderParams(node);
            if (params != null) {
                script.append(variable).append(".addParams(").append(params).append(")\n");
            }
        }

        // 2. 连接
        script.append("\n# Links\n");
        int ordinal = 0;
        for (ResolvedLink link : links) {
            String from = requireVariable(variables, link.getFromNode());
            String to = requireVariable(variables, link.getToNode());
            script.append("sst.Link(").append(quote(LINK_PREFIX + ordinal++)).append(").connect(\n")
                    .append("    (").append(from).append(", ").append(quote(link.getFromPort())).append(", LINK_DELAY),\n")
                    .append("    (").append(to).append(", ").append(quote(link.getToPort())).append(", LINK_DELAY)\n")
                    .append(")\n");
        }

        log.info("Rendered SST script with {} components and {} links", variables.size(), links.size());
        return script.toString();
    }

    private String componentType(ComponentNode node, NetlistProperties.Render config) {
        if (!StringUtils.hasText(config.getElementLibrary())) {
            return node.getClassName();
        }
        return config.getElementLibrary() + "." + node.getClassName();
    }

    private String requireVariable(Map<ComponentNode, String> variables, ComponentNode node) {
        String variable = variables.get(node);
        if (variable == null) {
            throw new IllegalStateException("Link endpoint " + node.getName() + " is not a leaf component");
        }
        return variable;
    }

    private String variableName(String instanceName, Set<String> used) {
        String base = instanceName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (base.isEmpty() || Character.isDigit(base.charAt(0))) {
            base = "_" + base;
        }
        String candidate = base;
        int suffix = 1;
        while (!used.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * 参数 JSON 转为 Python 字面量，空参数返回 null
     */
    private String renderParams(ComponentNode node) {
        if (!StringUtils.hasText(node.getParams())) {
            return null;
        }
        try {
            JsonNode params = mapper.readTree(node.getParams());
            if (params.isObject() && params.isEmpty()) {
                return null;
            }
            return pythonLiteral(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Params of component " + node.getName() + " are not valid JSON", e);
        }
    }

    private String pythonLiteral(JsonNode value) {
        if (value.isObject()) {
            StringBuilder dict = new StringBuilder("{");
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                dict.append(quote(field.getKey())).append(": ").append(pythonLiteral(field.getValue()));
                if (fields.hasNext()) {
                    dict.append(", ");
                }
            }
            return dict.append("}").toString();
        }
        if (value.isArray()) {
            StringBuilder list = new StringBuilder("[");
            for (int i = 0; i < value.size(); i++) {
                if (i > 0) {
                    list.append(", ");
                }
                list.append(pythonLiteral(value.get(i)));
            }
            return list.append("]").toString();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? "True" : "False";
        }
        if (value.isNull()) {
            return "None";
        }
        if (value.isNumber()) {
            return value.asText();
        }
        return quote(value.asText());
    }

    private String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
