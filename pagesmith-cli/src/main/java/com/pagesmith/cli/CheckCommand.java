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
 * Command to validate page sources without writing output.
 *
 * <p>Every source is read and its header normalized, which reports unreadable
 * files and malformed headers.
 */
@Command(
    name = "check",
    description = "Validate page sources and headers without writing output",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", description = "Site directory (default: current directory)", defaultValue = ".")
    private Path sitePath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: pagesmith.yaml)")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            log.info("Checking site: {}", sitePath.toAbsolutePath());
            SiteConfig config = ConfigLoader.loadSite(sitePath, configPath);
            BuildReport report = new SiteBuilder(SiteContext.create(config)).check();

            ReportPrinter.print(report, "Valid");
            return report.isSuccessful() ? ExitCodes.OK : ExitCodes.PAGE_FAILURES;

        } catch (Exception e) {
            log.error("Check failed", e);
            System.err.println("✗ Check failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
