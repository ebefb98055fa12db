package com.imperium.exhibitlinker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI exhibitLinkerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Exhibit Linker API")
                        .description("Exhibit 引用与 Bates 编号解析、相对链接生成接口文档")
                        .version("v0")
                        .contact(new Contact().name("Exhibit Linker Team")))
                .servers(List.of(
                        new Server().url("http://localhost:8093").description("Local")
                ));
    }
}
