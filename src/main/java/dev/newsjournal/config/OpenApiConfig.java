package dev.newsjournal.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("News Journal API")
                        .description("""
                                Personal reading journal over the article catalog.

                                ## Usage
                                1. Open a session: `POST /api/v1/journal/sessions`
                                2. Send the returned id in the `X-Journal-Session` header
                                3. Queue, reorder and read articles under `/api/v1/journal`

                                Journal results carry `status` (`success` or `error`) and, on error,
                                one of the error kinds `OutOfRange`, `NotFound`, `InvalidArgument`,
                                `JournalExhausted`, `PartialFailure`.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local server")));
    }
}
