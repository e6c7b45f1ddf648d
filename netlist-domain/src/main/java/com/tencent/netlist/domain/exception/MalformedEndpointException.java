package com.tencent.netlist.domain.exception;

import lombok.Getter;

/**
 * 连接串无法解析：端口名为空，或类型路径中存在非整数段。
 */
@Getter
public class MalformedEndpointException extends NetlistResolutionException {

    private final String rawConnection;

    public MalformedEndpointException(String rawConnection, String reason) {
        super("Malformed connection '" + rawConnection + "': " + reason);
        this.rawConnection = rawConnection;
    }

    public MalformedEndpointException(String rawConnection, String reason, Throwable cause) {
        super("Malformed connection '" + rawConnection + "': " + reason, cause);
        this.rawConnection = rawConnection;
    }

    @Override
    public String getErrorCode() {
        return "MALFORMED_ENDPOINT";
    }
}
