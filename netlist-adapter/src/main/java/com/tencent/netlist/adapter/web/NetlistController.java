package com.tencent.netlist.adapter.web;

import com.tencent.netlist.app.service.NetlistAppService;
import com.tencent.netlist.client.dto.MultiResponse;
import com.tencent.netlist.client.dto.SingleResponse;
import com.tencent.netlist.client.dto.data.ConfigScriptDTO;
import com.tencent.netlist.client.dto.data.ResolvedLinkDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * NetlistController - 网表接口
 * <p>
 * 请求体是 Drawflow 编辑器导出的原始 JSON。
 * </p>
 */
@RestController
@RequestMapping("/api/netlist")
@RequiredArgsConstructor
public class NetlistController {

    private final NetlistAppService netlistAppService;

    /**
     * 展开并解析所有连接
     */
    @PostMapping(value = "/links", consumes = MediaType.APPLICATION_JSON_VALUE)
    public MultiResponse<ResolvedLinkDTO> resolveLinks(@RequestBody String drawflowJson) {
        return MultiResponse.of(netlistAppService.resolveLinks(drawflowJson));
    }

    /**
     * 生成 SST 配置脚本
     */
    @PostMapping(value = "/config", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SingleResponse<ConfigScriptDTO> generateConfig(@RequestBody String drawflowJson) {
        return SingleResponse.of(netlistAppService.generateConfig(drawflowJson));
    }
}
