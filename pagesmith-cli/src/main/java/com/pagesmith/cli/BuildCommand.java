package com.pagesmith.cli;

import com.pagesmith.core.config.ConfigLoader;
import com.pagesmith.core.config.SiteConfig;
import com.pagesmith.core.page.SiteContext;
import com.pagesmith.core.site.BuildReport;
import com.pagesmith.core.site.SiteBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to build every page of a site.
 *
 * <p>Runs the page pipeline for each source under {@code content_dir}:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Discover page sources</li>
 *   <li>Load, normalize and render each page</li>
 *   <li>Write pages under {@code output_dir}</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Build the site in the current directory
 * pagesmith build
 *
 * # Build a specific site into another directory
 * pagesmith build /path/to/site -o /tmp/out
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build all pages of a site",
    mixinStandardHelpOptions = true
)
public class BuildCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Parameters(
        index = "0",
        description = "Site directory (default: current directory)",
        defaultValue = "."
    )
    private Path sitePath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pagesmith.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-j", "--threads"},
        description = "Number of pages built in parallel (default: 1)"
    )
    private int threads = 1;

    @Override
    public Integer call() {
        try {
            log.info("Building site: {}", sitePath.toAbsolutePath());
            System.out.println("Building site: " + sitePath.toAbsolutePath());
            System.out.println();

            SiteConfig config = ConfigLoader.loadSite(sitePath, configPath);
            if (outputDir != null) {
                config = config.withOutputDir(outputDir.toAbsolutePath().toString());
            }
            SiteBuilder builder = new SiteBuilder(SiteContext.create(config), threads);
            BuildReport report = builder.build();

            ReportPrinter.print(report, "Wrote");
            System.out.println("Output directory: " + config.outputPath().toAbsolutePath());
            return report.isSuccessful() ? ExitCodes.OK : ExitCodes.PAGE_FAILURES;

        } catch (Exception e) {
            log.error("Build failed", e);
            System.err.println("✗ Build failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
