package com.smallbiz.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.smallbiz.agent.config")
@EnableJpaRepositories(basePackages = "com.smallbiz.agent.repository")
@EntityScan(basePackages = "com.smallbiz.agent.entity")
public class SmallBizAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmallBizAgentApplication.class, args);
    }
}
