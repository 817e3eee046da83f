package com.company.fermentation;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Fermentation Monitor API",
                version = "1.0.0",
                description = "Fermentation quality monitoring against a reference trajectory, with live batch streaming"
        )
)
public class FermentationMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FermentationMonitorApplication.class, args);
    }
}
