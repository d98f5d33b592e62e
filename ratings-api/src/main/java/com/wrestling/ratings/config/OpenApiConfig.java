package com.wrestling.ratings.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wrestlingRatingsOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Wrestling Ratings API")
                        .description("Glicko-2 ratings and weight-class leaderboards computed from scraped " +
                                "wrestling results. Source data is read from MongoDB; only leaderboards are written.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
