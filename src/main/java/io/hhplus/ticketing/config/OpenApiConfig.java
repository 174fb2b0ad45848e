package io.hhplus.ticketing.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Movie Ticketing Backend API")
                .description("영화 티켓 발권 및 환불 API (Idempotency-Key 기반 재시도 안전성)")
                .version("0.1.0"));
    }
}
