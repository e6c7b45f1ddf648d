package com.tencent.netlist.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrawflowNodeDto {
    private int id;
    private String name; // className
    private JsonNode data; // params + links.inputs / links.outputs
    private Map<String, DrawflowPortDto> inputs = new LinkedHashMap<>();
    private Map<String, DrawflowPortDto> outputs = new LinkedHashMap<>();
}
