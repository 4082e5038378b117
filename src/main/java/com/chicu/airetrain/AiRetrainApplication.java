package com.chicu.airetrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.chicu.airetrain")
@ConfigurationPropertiesScan("com.chicu.airetrain")
public class AiRetrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiRetrainApplication.class, args);
    }
}
