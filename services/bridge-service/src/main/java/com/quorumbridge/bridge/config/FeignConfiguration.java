package com.quorumbridge.bridge.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "com.quorumbridge.bridge.client")
public class FeignConfiguration {
}
