package com.corebank.ledger.config;

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
    public OpenAPI coreBankOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080/api");
        localServer.setDescription("Local Development Server");

        Contact contact = new Contact();
        contact.setName("CoreBank Team");
        contact.setEmail("ledger@corebank.local");

        Info info = new Info()
                .title("CoreBank Ledger API")
                .version("1.0.0")
                .description("Double-entry ledger with deposits, withdrawals, transfers " +
                             "and investment purchase/redemption")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
