package com.subradar.grouping.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GroupingProperties.class)
public class GroupingConfig {
}
