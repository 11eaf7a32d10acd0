package com.jimin.blog.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI 문서 정보
 *
 * springdoc.api-docs.enabled=true 인 경우(dev 프로필)에만 등록
 *  - /swagger-ui.html
 *  - /v3/api-docs
 */
@Configuration
@ConditionalOnProperty(name = "springdoc.api-docs.enabled", havingValue = "true")
public class OpenApiConfig {

    @Bean
    public OpenAPI blogOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Blog API")
                        .description("게시글(Post) / 댓글(Comment) CRUD API")
                        .version("1.0.0"));
    }
}
