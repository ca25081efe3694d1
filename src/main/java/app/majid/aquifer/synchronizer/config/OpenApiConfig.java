package app.majid.aquifer.synchronizer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI aquiferOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Aquifer - Schema Synchronizer API")
                        .description("REST API for propagating tables, views and stored procedures from a source " +
                                "database to target databases. Every applied change is validated in a rolled-back " +
                                "transaction first and recorded in the target's sync_log for rollback.")
                        .version("0.0.1-SNAPSHOT")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Development server")
                ));
    }
}
