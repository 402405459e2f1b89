package com.example.identity_resolution_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 研究者身份识别引擎启动类
 */
@SpringBootApplication
public class IdentityResolutionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityResolutionEngineApplication.class, args);
    }
}
