package com.example.courier.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${instance.id:${HOSTNAME:courier-realtime-0}}")
    private String instanceId;

    @Bean
    @ConfigurationProperties(prefix = "courier")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Set explicitly; everything under courier.* is bound by @ConfigurationProperties
        properties.setInstanceId(instanceId);

        return properties;
    }
}
