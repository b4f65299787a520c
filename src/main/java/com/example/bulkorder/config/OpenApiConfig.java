package com.example.bulkorder.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger/OpenAPI 설정
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shopline 주문 일괄 등록 API")
                        .description("CSV/엑셀 파일을 업로드하여 Shopline 스토어에 주문을 일괄 생성하는 API")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Bulk Order Service")
                                .email("support@example.com")));
    }
}
