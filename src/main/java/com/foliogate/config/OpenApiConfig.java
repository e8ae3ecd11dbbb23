package com.foliogate.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI folioGateOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("FolioGate API")
                        .description("Public share links for resumes and cover letters, and a rate-limited, audited AI gateway")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FolioGate Team")
                                .email("support@foliogate.example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")));
    }
}
