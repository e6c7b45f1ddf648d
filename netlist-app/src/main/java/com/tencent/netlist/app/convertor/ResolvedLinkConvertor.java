package com.tencent.netlist.app.convertor;

import com.tencent.netlist.client.dto.data.ResolvedLinkDTO;
import com.tencent.netlist.domain.resolver.ResolvedLink;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ResolvedLink 领域对象 -> 传输对象
 */
public final class ResolvedLinkConvertor {

    private ResolvedLinkConvertor() {
    }

    public static ResolvedLinkDTO toDTO(ResolvedLink link) {
        return ResolvedLinkDTO.builder()
                .fromComponent(link.getFromNode().getName())
                .fromPort(link.getFromPort())
                .toComponent(link.getToNode().getName())
                .toPort(link.getToPort())
                .build();
    }

    public static List<ResolvedLinkDTO> toDTOs(List<ResolvedLink> links) {
        return links.stream().map(ResolvedLinkConvertor::toDTO).collect(Collectors.toList());
    }
}
