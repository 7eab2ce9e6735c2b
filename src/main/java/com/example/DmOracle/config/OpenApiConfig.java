package com.example.DmOracle.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI metadata. The API version follows {@code oracle.version}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI oracleOpenApi(OracleProperties props) {
        return new OpenAPI()
                .info(new Info()
                        .title("Dungeon Master's Oracle API")
                        .version(props.version())
                        .description("Hybrid RAG answers about D&D rules, lore and monster statistics")
                        .license(new License()
                                .name("SRD 5.1 content under CC-BY-4.0")
                                .url("https://creativecommons.org/licenses/by/4.0/")));
    }
}
