package com.example.identity_resolution_engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 引擎基础配置：配置属性绑定与时钟（用于计算近五年的检索区间）
 */
@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
