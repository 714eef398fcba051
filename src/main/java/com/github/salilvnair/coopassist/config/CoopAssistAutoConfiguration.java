package com.github.salilvnair.coopassist.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.coopassist")
@ComponentScan(basePackages = "com.github.salilvnair.coopassist")
public class CoopAssistAutoConfiguration {
}
