package com.tencent.netlist.adapter.web;

import com.tencent.netlist.client.dto.Response;
import com.tencent.netlist.domain.exception.NetlistResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 解析失败统一转为 400 + 失败响应，错误码取自异常
 */
@Slf4j
@RestControllerAdvice
public class NetlistExceptionHandler {

    static final String INVALID_COMPOSITION = "INVALID_COMPOSITION";

    @ExceptionHandler(NetlistResolutionException.class)
    public ResponseEntity<Response> handleResolutionFailure(NetlistResolutionException e) {
        log.warn("Netlist resolution failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Response.buildFailure(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<Response> handleInvalidComposition(RuntimeException e) {
        log.warn("Invalid composition: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Response.buildFailure(INVALID_COMPOSITION, e.getMessage()));
    }
}
