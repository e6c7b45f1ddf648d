package com.tencent.netlist.infrastructure.config;

import com.tencent.netlist.domain.tree.TieBreakPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * NetlistProperties - 网表解析与渲染配置
 * <p>
 * 对应 application.yml 中的 {@code netlist.*}。
 * </p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "netlist")
public class NetlistProperties {

    @Valid
    private Resolver resolver = new Resolver();

    @Valid
    private Render render = new Render();

    @Data
    public static class Resolver {

        /**
         * 同一作用域内出现多个同类型节点时的处理方式
         */
        @NotNull
        private TieBreakPolicy tieBreak = TieBreakPolicy.FIRST_MATCH;
    }

    @Data
    public static class Render {

        /**
         * 每条 SST Link 的延迟
         */
        @NotBlank
        private String linkDelay = "1ps";

        /**
         * SST 元素库名，为空时组件类型直接使用类名
         */
        private String elementLibrary = "";
    }
}
