package co.fanki.editorguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Editor Guard Application.
 *
 * <p>Checks Unity C# sources for editor-only namespaces imported into
 * code that is also compiled into player builds. Runs as a REST service,
 * as an MCP stdio server ({@code mcp.server.stdio=true}) or as a one-shot
 * batch scan ({@code editorguard.batch.project-root=...}).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class EditorGuardApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        final ConfigurableApplicationContext context =
                SpringApplication.run(EditorGuardApplication.class, args);

        // Batch scans report their result through the exit status.
        if (context.containsBean("batchScanRunner")) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
