package com.pagesmith.core.page;

import com.pagesmith.core.config.SiteConfig;
import com.pagesmith.core.metadata.MetadataNormalizer;
import com.pagesmith.core.renderer.BodyRenderers;
import com.pagesmith.core.template.TemplateEngine;
import com.pagesmith.core.template.impl.MustacheTemplateEngine;

import java.time.Clock;
import java.util.Objects;

/**
 * Everything a {@link Page} needs from its surroundings during one build.
 *
 * <p>Created once per run and shared by reference between pages, including pages
 * built on different threads. All members are immutable or thread-safe.
 *
 * @param config site configuration
 * @param templateEngine engine resolving page templates
 * @param normalizer metadata normalizer
 * @param renderers available body renderers
 */
public record SiteContext(
    SiteConfig config,
    TemplateEngine templateEngine,
    MetadataNormalizer normalizer,
    BodyRenderers renderers
) {

    /**
     * Compact constructor with validation.
     */
    public SiteContext {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(templateEngine, "templateEngine must not be null");
        Objects.requireNonNull(normalizer, "normalizer must not be null");
        Objects.requireNonNull(renderers, "renderers must not be null");
    }

    /**
     * Creates a context with Mustache templates from {@code template_dir},
     * the system clock and the renderers registered via SPI.
     *
     * @param config site configuration
     * @return new context
     */
    public static SiteContext create(SiteConfig config) {
        return create(config, Clock.systemDefaultZone());
    }

    /**
     * Creates a context whose normalizer reads the time from {@code clock}.
     *
     * @param config site configuration
     * @param clock clock stamping pages without a date
     * @return new context
     */
    public static SiteContext create(SiteConfig config, Clock clock) {
        return new SiteContext(
            config,
            new MustacheTemplateEngine(config.templatePath()),
            new MetadataNormalizer(clock),
            BodyRenderers.discover()
        );
    }
}
