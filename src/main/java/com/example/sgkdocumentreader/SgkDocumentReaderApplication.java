package com.example.sgkdocumentreader;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import com.example.sgkdocumentreader.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "SGK Document Reader API",
                version = "1.0",
                description = "REST API for rectifying, reading, matching, classifying and filing SGK documents uploaded for a patient.",
                contact = @Contact(name = "SGK Document Reader")))
@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class SgkDocumentReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(SgkDocumentReaderApplication.class, args);
    }
}
