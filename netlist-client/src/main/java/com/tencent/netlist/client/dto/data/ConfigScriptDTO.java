package com.tencent.netlist.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 生成的 SST 配置脚本
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigScriptDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String script;
    private int componentCount;
    private int linkCount;
}
