package com.demo.rent.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI rentGateOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("ZK Rent Gate API")
                .description("Policies, eligibility gates (proof / attestation), lease escrow. "
                        + "Callers identify themselves with the X-Caller-Address header.")
                .version("v1"));
    }
}
