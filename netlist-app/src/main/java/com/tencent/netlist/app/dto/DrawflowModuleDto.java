package com.tencent.netlist.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drawflow 导出中的一个模块 (画布页签)，data 以节点 ID 字符串为键
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrawflowModuleDto {
    private Map<String, DrawflowNodeDto> data = new LinkedHashMap<>();
}
