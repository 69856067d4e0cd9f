package com.routely.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class OpenApiConfig implements WebMvcConfigurer {

        /**
         * Maps "/docs" to the Swagger UI.
         */
        @Override
        public void addViewControllers(ViewControllerRegistry registry) {
                registry.addRedirectViewController("/docs", "/swagger-ui/index.html");
                registry.addRedirectViewController("/docs/", "/swagger-ui/index.html");
        }

        @Bean
        public OpenAPI routelyOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Routely API documentation")
                                                .description(
                                                                "### Routely route planning and fare engine\n\n" +
                                                                                "Plans journeys across a multi-operator urban rail network and prices every itinerary per passenger type.\n\n"
                                                                                +
                                                                                "#### Key Features:\n" +
                                                                                "- **Route Planning**: fastest, cheapest or fewest-transfers itineraries with up to five alternatives.\n"
                                                                                +
                                                                                "- **Fares**: zone and per-station pricing, passenger discounts, transfer fees and group brackets.\n"
                                                                                +
                                                                                "- **Live Overlay**: closures and delays applied per request without touching the network.\n")
                                                .version("v1.0.0")
                                                .contact(new Contact()
                                                                .name("Routely")
                                                                .email("support@routely.app"))
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development (HTTP)")));
        }
}
