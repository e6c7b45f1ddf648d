package com.tencent.netlist.adapter.web;

import com.tencent.netlist.client.dto.Response;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康检查
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    @GetMapping("/health")
    public Response health() {
        return Response.buildSuccess();
    }
}
