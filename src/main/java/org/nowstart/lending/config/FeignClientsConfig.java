package org.nowstart.lending.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableFeignClients(basePackages = "org.nowstart.lending.repository")
public class FeignClientsConfig {
}
