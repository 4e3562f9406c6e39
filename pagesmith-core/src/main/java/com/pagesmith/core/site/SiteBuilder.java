package com.pagesmith.core.site;

import com.pagesmith.core.exception.PageException;
import com.pagesmith.core.page.Page;
import com.pagesmith.core.page.SiteContext;
import com.pagesmith.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds every page source found under the content directory.
 *
 * <p>Each source is loaded, rendered and written independently. A page that fails
 * is logged and recorded in the {@link BuildReport}; the remaining pages are still
 * built. With more than one thread, pages are built concurrently and share only
 * the read-only {@link SiteContext}.
 *
 * <p>Pages whose {@code published} flag is false are skipped.
 */
public class SiteBuilder {

    private static final Logger log = LoggerFactory.getLogger(SiteBuilder.class);

    /** Template variable holding the {@code site} section of the configuration. */
    public static final String SITE_VARIABLE = "site";

    private final SiteContext context;
    private final int threads;

    public SiteBuilder(SiteContext context) {
        this(context, 1);
    }

    /**
     * @param context build context shared by all pages
     * @param threads number of pages built concurrently, at least 1
     */
    public SiteBuilder(SiteContext context, int threads) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.threads = threads;
    }

    /**
     * Lists the page sources under the content directory.
     *
     * @return sources with an extension some renderer handles, sorted by path
     * @throws IOException if the content directory cannot be walked
     */
    public List<Path> discoverSources() throws IOException {
        Path contentDir = context.config().contentPath();
        if (!Files.isDirectory(contentDir)) {
            throw new IOException("Content directory does not exist: " + contentDir.toAbsolutePath());
        }
        List<Path> sources = FileUtils.findFiles(contentDir, context.renderers().extensions());
        log.info("Found {} page sources in {}", sources.size(), contentDir);
        return sources;
    }

    /**
     * Builds and writes all pages.
     *
     * @return build report
     * @throws IOException if the content directory cannot be walked
     */
    public BuildReport build() throws IOException {
        return run(discoverSources(), true);
    }

    /**
     * Loads and normalizes all pages without rendering templates or writing output.
     *
     * @return report of pages with valid sources
     * @throws IOException if the content directory cannot be walked
     */
    public BuildReport check() throws IOException {
        return run(discoverSources(), false);
    }

    /**
     * Builds the given sources.
     *
     * @param sources page source files
     * @param write whether to render and write pages, or only load them
     * @return build report
     */
    public BuildReport run(List<Path> sources, boolean write) {
        List<Outcome> outcomes = threads == 1 || sources.size() < 2
            ? sources.stream().map(source -> buildPage(source, write)).toList()
            : runConcurrently(sources, write);

        List<Path> succeeded = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        List<BuildReport.Failure> failed = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCEEDED -> succeeded.add(outcome.source());
                case SKIPPED -> skipped.add(outcome.source());
                case FAILED -> failed.add(new BuildReport.Failure(outcome.source(), outcome.message()));
            }
        }

        BuildReport report = new BuildReport(succeeded, skipped, failed);
        log.info("Processed {} pages: {} succeeded, {} skipped, {} failed",
            report.total(), succeeded.size(), skipped.size(), failed.size());
        return report;
    }

    private List<Outcome> runConcurrently(List<Path> sources, boolean write) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, sources.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Path source : sources) {
                futures.add(executor.submit(() -> buildPage(source, write)));
            }

            List<Outcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), sources.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome await(Future<Outcome> future, Path source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building " + source, e);
        } catch (ExecutionException e) {
            log.error("Failed to build {}", source, e.getCause());
            return Outcome.failed(source, failureMessage(e.getCause()));
        }
    }

    private Outcome buildPage(Path source, boolean write) {
        try {
            Page page = Page.load(source, context);
            if (!write) {
                return Outcome.succeeded(source);
            }
            if (!page.isPublished()) {
                log.info("Skipping unpublished page {}", page.getSlug());
                return Outcome.skipped(source);
            }

            page.render(Map.of(SITE_VARIABLE, context.config().site()));
            Path target = page.write();
            log.info("Wrote {} -> {}", source, target);
            return Outcome.succeeded(source);
        } catch (PageException e) {
            log.error("Failed to build {}: {}", source, e.getMessage());
            log.debug("Failure details for {}", source, e);
            return Outcome.failed(source, failureMessage(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error while building {}", source, e);
            return Outcome.failed(source, failureMessage(e));
        }
    }

    private static String failureMessage(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }

    private enum Status { SUCCEEDED, SKIPPED, FAILED }

    private record Outcome(Path source, Status status, String message) {

        static Outcome succeeded(Path source) {
            return new Outcome(source, Status.SUCCEEDED, null);
        }

        static Outcome skipped(Path source) {
            return new Outcome(source, Status.SKIPPED, null);
        }

        static Outcome failed(Path source, String message) {
            return new Outcome(source, Status.FAILED, message);
        }
    }
}
