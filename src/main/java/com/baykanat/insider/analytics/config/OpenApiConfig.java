package com.baykanat.insider.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI analyticsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Insider - Web Analytics Query API")
                        .description("""
                                Read-side analytics API over the ClickHouse events table. \
                                Compiles time-ranged, filtered and bucketed requests into site-scoped SQL \
                                (overview time series, session and user lists, session details).\
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:3001").description("Local Development")
                ));
    }
}
