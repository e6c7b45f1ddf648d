package com.tencent.netlist.domain.exception;

import lombok.Getter;

/**
 * NetlistResolutionException - 连接解析异常基类
 * <p>
 * 解析过程不做重试也不做部分恢复，任何失败都会中止当前解析并携带上下文
 * (出错节点名称、原始连接串) 抛给调用方。
 * </p>
 */
@Getter
public class NetlistResolutionException extends RuntimeException {

    private String nodeName;

    private String connection;

    public NetlistResolutionException(String message) {
        super(message);
    }

    public NetlistResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 补充出错位置，已有的上下文不会被覆盖
     */
    public NetlistResolutionException withContext(String nodeName, String connection) {
        if (this.nodeName == null) {
            this.nodeName = nodeName;
        }
        if (this.connection == null) {
            this.connection = connection;
        }
        return this;
    }

    public String getErrorCode() {
        return "NETLIST_RESOLUTION_FAILURE";
    }

    @Override
    public String getMessage() {
        StringBuilder message = new StringBuilder(super.getMessage());
        if (nodeName != null) {
            message.append(" [node: ").append(nodeName).append("]");
        }
        if (connection != null) {
            message.append(" [connection: ").append(connection).append("]");
        }
        return message.toString();
    }
}
