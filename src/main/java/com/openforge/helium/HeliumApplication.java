package com.openforge.helium;

import com.openforge.helium.agent.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class HeliumApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeliumApplication.class, args);
    }
}
