package com.tencent.netlist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Netlist Application Entry Point
 */
@SpringBootApplication
public class NetlistApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetlistApplication.class, args);
    }
}
