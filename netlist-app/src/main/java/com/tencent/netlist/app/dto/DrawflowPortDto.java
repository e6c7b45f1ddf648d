package com.tencent.netlist.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrawflowPortDto {
    private List<DrawflowConnectionDto> connections = new ArrayList<>();
}
