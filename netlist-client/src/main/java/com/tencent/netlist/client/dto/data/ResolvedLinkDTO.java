package com.tencent.netlist.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 已解析连接的传输对象，两端均为叶子组件实例名
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedLinkDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String fromComponent;
    private String fromPort;
    private String toComponent;
    private String toPort;
}
