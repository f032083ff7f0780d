package com.voltscope.service.core.config;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@ComponentScan(basePackages = {"com.voltscope.service.core"})
@EnableConfigurationProperties
public class SamplingAutoConfiguration {}
