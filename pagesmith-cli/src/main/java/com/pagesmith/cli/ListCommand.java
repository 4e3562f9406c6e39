package com.pagesmith.cli;

import com.pagesmith.core.renderer.BodyRenderer;
import com.pagesmith.core.renderer.BodyRenderers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list available body renderers.
 *
 * <p>Discovers renderers via Java Service Provider Interface (SPI) and displays
 * the file extensions they handle.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * pagesmith list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available body renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: renderers",
        defaultValue = "renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: renderers", type);
                yield ExitCodes.ERROR;
            }
        };
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        BodyRenderers renderers = BodyRenderers.discover();
        for (BodyRenderer renderer : renderers.all()) {
            System.out.printf("  • %s (ID: %s)%n", renderer.getDisplayName(), renderer.getId());
            System.out.printf("    Extensions: %s%n", new TreeSet<>(renderer.getExtensions()));
            System.out.println();
        }

        if (renderers.all().isEmpty()) {
            System.out.println("  No renderers found.");
        }

        return ExitCodes.OK;
    }
}
