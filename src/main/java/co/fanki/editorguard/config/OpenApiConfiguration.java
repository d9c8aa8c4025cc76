package co.fanki.editorguard.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Editor Guard API.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Editor Guard API")
                        .description("""
                                Editor Guard - finds editor-only namespaces (UnityEditor) imported into
                                code that is also compiled into player builds.

                                A `using UnityEditor;` directive is accepted when its file lives under an
                                `Editor` folder or when an enclosing `#if`/`#elif` mentions `UNITY_EDITOR`.
                                Every other one is reported as `UEA001` with severity error.

                                ## MCP Tools
                                - `check_source` - Check a single source file
                                - `explain_source` - Explain the verdict for each using directive
                                - `scan_project` - Scan every source file of a project
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
