package com.example.FinSolve.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "FinSolve Assistant API",
                version = "v1",
                description = "Role-aware question answering over internal FinSolve documents"
        )
)
public class OpenApiConfig {
}
