package io.github.drompincen.devgateway.gateway;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.devgateway.gateway")
@EnableConfigurationProperties(GatewayProperties.class)
public class DevGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(DevGatewayApplication.class, args);
    }
}
