package com.example.roomchat.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Documents the REST endpoints: code join, room lookup and history. Other room mutations,
 * messaging and calls happen over Socket.IO and are not part of this document.
 */
@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Room Live Chat API",
                        version = "1.0",
                        description = "Join by code, room lookup by join code and message history."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi roomsApi() {
        return GroupedOpenApi.builder()
                .group("rooms")
                .pathsToMatch("/api/rooms/**")
                .build();
    }
}
