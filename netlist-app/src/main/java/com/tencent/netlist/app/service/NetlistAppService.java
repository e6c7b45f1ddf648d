package com.tencent.netlist.app.service;

import com.tencent.netlist.app.convertor.ResolvedLinkConvertor;
import com.tencent.netlist.app.parser.DrawflowJsonParser;
import com.tencent.netlist.client.dto.data.ConfigScriptDTO;
import com.tencent.netlist.client.dto.data.ResolvedLinkDTO;
import com.tencent.netlist.domain.composition.Composition;
import com.tencent.netlist.domain.gateway.ConfigScriptRenderer;
import com.tencent.netlist.domain.service.Netlist;
import com.tencent.netlist.domain.service.NetlistFlatteningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * NetlistAppService - 网表应用服务
 * <p>
 * 编排 解析 -> 展开 -> 连接解析 -> 渲染。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetlistAppService {

    private final DrawflowJsonParser parser;
    private final NetlistFlatteningService flatteningService;
    private final ConfigScriptRenderer renderer;

    public List<ResolvedLinkDTO> resolveLinks(String drawflowJson) {
        Netlist netlist = flatten(drawflowJson);
        return ResolvedLinkConvertor.toDTOs(netlist.getLinks());
    }

    public ConfigScriptDTO generateConfig(String drawflowJson) {
        Netlist netlist = flatten(drawflowJson);
        String script = renderer.render(netlist.getTree(), netlist.getLinks());
        return ConfigScriptDTO.builder()
                .script(script)
                .componentCount(netlist.getLeaves().size())
                .linkCount(netlist.getLinks().size())
                .build();
    }

    private Netlist flatten(String drawflowJson) {
        Composition composition = parser.parse(drawflowJson);
        log.info("Flattening composition with modules {}", composition.getModules().keySet());
        return flatteningService.flatten(composition);
    }
}
