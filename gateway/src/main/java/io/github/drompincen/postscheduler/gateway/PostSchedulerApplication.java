package io.github.drompincen.postscheduler.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.postscheduler")
@ConfigurationPropertiesScan(basePackages = "io.github.drompincen.postscheduler.gateway.config")
public class PostSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostSchedulerApplication.class, args);
    }
}
