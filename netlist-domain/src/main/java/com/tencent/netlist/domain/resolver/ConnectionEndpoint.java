package com.tencent.netlist.domain.resolver;

import com.tencent.netlist.domain.exception.MalformedEndpointException;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ConnectionEndpoint - 解析后的连接串
 * <p>
 * 格式: {@code <port>[#<type>]*}，例如 "out1#3#7" 表示端口 out1，类型路径 [3, 7]。
 * 类型路径保持连接串中的顺序，解析下降时从末尾开始消费。
 * 路径为空表示端点就是声明连接的节点本身。
 * </p>
 */
@Value
public class ConnectionEndpoint {

    public static final String DELIMITER = "#";

    String portName;

    List<Integer> typePath;

    /**
     * @throws MalformedEndpointException 端口名为空或类型段不是整数
     */
    public static ConnectionEndpoint parse(String connection) {
        if (connection == null || connection.isBlank()) {
            throw new MalformedEndpointException(String.valueOf(connection), "connection is empty");
        }
        String[] segments = connection.split(DELIMITER, -1);
        String portName = segments[0].trim();
        if (portName.isEmpty()) {
            throw new MalformedEndpointException(connection, "port name is empty");
        }
        List<Integer> typePath = new ArrayList<>(segments.length - 1);
        for (int i = 1; i < segments.length; i++) {
            try {
                typePath.add(Integer.parseInt(segments[i].trim()));
            } catch (NumberFormatException e) {
                throw new MalformedEndpointException(connection,
                        "path segment '" + segments[i] + "' is not an integer", e);
            }
        }
        return new ConnectionEndpoint(portName, Collections.unmodifiableList(typePath));
    }

    public boolean isDirect() {
        return typePath.isEmpty();
    }
}
