package com.globalai.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI allocatorOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Global AI Long/Short Allocator API")
                        .description("Market data snapshots, strategy allocation and broker execution")
                        .version("1.0"));
    }
}
