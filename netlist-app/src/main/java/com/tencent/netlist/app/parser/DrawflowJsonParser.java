package com.tencent.netlist.app.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tencent.netlist.app.dto.DrawflowConnectionDto;
import com.tencent.netlist.app.dto.DrawflowModuleDto;
import com.tencent.netlist.app.dto.DrawflowNodeDto;
import com.tencent.netlist.app.dto.DrawflowPortDto;
import com.tencent.netlist.domain.component.ComponentLink;
import com.tencent.netlist.domain.composition.Composition;
import com.tencent.netlist.domain.composition.ElementDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DrawflowJsonParser - Drawflow 导出解析器
 * <p>
 * 把编辑器导出的 JSON ({@code {"drawflow": {"<module>": {"data": {...}}}}}) 转为未展开的 {@link Composition}。
 * 每条输出连线成为一条声明连接: 输出端口名取自源节点 data.links.outputs，
 * 输入端口名取自目标节点 data.links.inputs。
 * </p>
 */
@Component
public class DrawflowJsonParser {

    private static final String DRAWFLOW_ROOT = "drawflow";

    private static final String LINKS_FIELD = "links";

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.ACCEPT_EMPTY_ARRAY_AS_NULL_OBJECT, true);

    public Composition parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Drawflow export is empty");
        }
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode modules = root.has(DRAWFLOW_ROOT) ? root.get(DRAWFLOW_ROOT) : root;
            if (!modules.isObject()) {
                throw new IllegalArgumentException("Drawflow export must be a JSON object of modules");
            }
            Map<String, DrawflowModuleDto> dto = mapper.convertValue(modules,
                    new TypeReference<LinkedHashMap<String, DrawflowModuleDto>>() {
                    });
            return convert(dto);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse Drawflow export", e);
        }
    }

    private Composition convert(Map<String, DrawflowModuleDto> modules) throws JsonProcessingException {
        Composition.CompositionBuilder builder = Composition.builder();
        for (Map.Entry<String, DrawflowModuleDto> module : modules.entrySet()) {
            Map<String, DrawflowNodeDto> nodes = module.getValue() == null || module.getValue().getData() == null
                    ? Map.of() : module.getValue().getData();
            List<ElementDefinition> elements = new ArrayList<>();
            for (DrawflowNodeDto node : nodes.values()) {
                elements.add(convertNode(module.getKey(), node, nodes));
            }
            builder.module(module.getKey(), elements);
        }
        return builder.build();
    }

    private ElementDefinition convertNode(String moduleName, DrawflowNodeDto node,
                                          Map<String, DrawflowNodeDto> moduleNodes) throws JsonProcessingException {
        List<ComponentLink> links = new ArrayList<>();
        List<String> outputNames = portNames(node, "outputs");
        if (node.getOutputs() != null) {
            for (Map.Entry<String, DrawflowPortDto> output : node.getOutputs().entrySet()) {
                String fromPort = portName(outputNames, output.getKey());
                List<DrawflowConnectionDto> connections =
                        output.getValue() == null || output.getValue().getConnections() == null
                                ? List.of() : output.getValue().getConnections();
                for (DrawflowConnectionDto connection : connections) {
                    DrawflowNodeDto target = moduleNodes.get(connection.getNode());
                    if (target == null) {
                        throw new IllegalArgumentException("Node " + node.getId() + " in module " + moduleName
                                + " connects to unknown node " + connection.getNode());
                    }
                    String toPort = portName(portNames(target, "inputs"), connection.getOutput());
                    links.add(ComponentLink.builder()
                            .fromPort(fromPort)
                            .toNodeType(target.getId())
                            .toPort(toPort)
                            .build());
                }
            }
        }

        return ElementDefinition.builder()
                .id(node.getId())
                .className(node.getName())
                .links(links)
                .params(params(node))
                .build();
    }

    /**
     * data.links 中声明的端口名列表
     */
    private List<String> portNames(DrawflowNodeDto node, String direction) {
        List<String> names = new ArrayList<>();
        if (node.getData() == null) {
            return names;
        }
        for (JsonNode name : node.getData().path(LINKS_FIELD).path(direction)) {
            names.add(name.asText());
        }
        return names;
    }

    /**
     * "output_2" / "input_2" 对应端口名列表中的第 2 个；没有声明名称时沿用 Drawflow 的键
     */
    private String portName(List<String> names, String drawflowKey) {
        if (drawflowKey == null) {
            throw new IllegalArgumentException("Drawflow connection is missing its port key");
        }
        int separator = drawflowKey.lastIndexOf('_');
        try {
            int position = Integer.parseInt(drawflowKey.substring(separator + 1));
            if (position >= 1 && position <= names.size()) {
                return names.get(position - 1);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unexpected Drawflow port key: " + drawflowKey, e);
        }
        return drawflowKey;
    }

    private String params(DrawflowNodeDto node) throws JsonProcessingException {
        if (node.getData() == null || !node.getData().isObject()) {
            return null;
        }
        ObjectNode params = node.getData().deepCopy();
        params.remove(LINKS_FIELD);
        return params.isEmpty() ? null : mapper.writeValueAsString(params);
    }
}
