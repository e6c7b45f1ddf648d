package com.tencent.netlist.infrastructure.config;

import com.tencent.netlist.domain.builder.ComponentTreeBuilder;
import com.tencent.netlist.domain.service.NetlistFlatteningService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * NetlistConfig - 领域服务装配
 *
 * @author netlist
 */
@Configuration
@EnableConfigurationProperties(NetlistProperties.class)
public class NetlistConfig {

    @Bean
    public ComponentTreeBuilder componentTreeBuilder() {
        return new ComponentTreeBuilder();
    }

    @Bean
    public NetlistFlatteningService netlistFlatteningService(ComponentTreeBuilder componentTreeBuilder,
                                                             NetlistProperties properties) {
        return new NetlistFlatteningService(componentTreeBuilder, properties.getResolver().getTieBreak());
    }
}
