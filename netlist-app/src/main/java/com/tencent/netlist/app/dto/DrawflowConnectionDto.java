package com.tencent.netlist.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Drawflow 连线。输出端口上的连线用 output 记录目标输入键 (如 "input_1")，
 * 输入端口上的连线用 input 记录来源输出键。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrawflowConnectionDto {
    private String node;
    private String output;
    private String input;
}
