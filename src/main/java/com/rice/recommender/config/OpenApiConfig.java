package com.rice.recommender.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Recipe Recommender API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API that turns a free-text food request into a ranked recipe shortlist."))
                .addTagsItem(new Tag().name("recommend").description("Recipe recommendations and intent diagnostics"));
    }
}
