package com.github.dimitryivaniuta.metergateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeterGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeterGatewayApplication.class, args);
    }
}
