package com.library.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lendingOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Library Lending API")
                .description("REST API for lending library books: status lookup, borrow, return "
                    + "and a per-book waiting list that reserves returned books for the next requester.")
                .version("1.0.0"));
    }
}
