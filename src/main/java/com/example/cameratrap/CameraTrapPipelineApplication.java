package com.example.cameratrap;

import com.example.cameratrap.config.PipelineProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@OpenAPIDefinition(
        info = @Info(
                title = "Camera Trap Pipeline API",
                version = "1.0",
                description = "Ingests camera trap images, runs animal detection and species classification, and exposes the stored results.",
                contact = @Contact(name = "Camera Trap Pipeline")))
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PipelineProperties.class)
public class CameraTrapPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CameraTrapPipelineApplication.class, args);
    }
}
