package com.jz.support;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@MapperScan("com.jz.support.mapper")
@ConfigurationPropertiesScan(basePackages = "com.jz.support")
public class SupportResponderApplication {
    public static void main(String[] args) {
        SpringApplication.run(SupportResponderApplication.class, args);
    }
}
