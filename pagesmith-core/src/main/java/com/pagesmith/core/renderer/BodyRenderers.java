package com.pagesmith.core.renderer;

import com.pagesmith.core.renderer.impl.PlainRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registry of the available {@link BodyRenderer}s.
 *
 * <p>Selection order for a page:
 * <ol>
 *   <li>a renderer id forced by configuration</li>
 *   <li>the renderer claiming the source file extension</li>
 *   <li>{@link PlainRenderer}</li>
 * </ol>
 */
public class BodyRenderers {

    private static final Logger log = LoggerFactory.getLogger(BodyRenderers.class);

    private final Map<String, BodyRenderer> byId;
    private final Map<String, BodyRenderer> byExtension;
    private final BodyRenderer fallback;

    /**
     * Creates a registry over the given renderers.
     *
     * <p>When two renderers share an id or extension, the first one wins.
     *
     * @param renderers available renderers
     */
    public BodyRenderers(Collection<? extends BodyRenderer> renderers) {
        Map<String, BodyRenderer> ids = new LinkedHashMap<>();
        Map<String, BodyRenderer> extensions = new LinkedHashMap<>();
        for (BodyRenderer renderer : renderers) {
            if (ids.putIfAbsent(renderer.getId(), renderer) != null) {
                log.warn("Duplicate body renderer id '{}', ignoring {}", renderer.getId(), renderer.getClass().getName());
                continue;
            }
            for (String extension : renderer.getExtensions()) {
                extensions.putIfAbsent(extension.toLowerCase(Locale.ROOT), renderer);
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byExtension = Collections.unmodifiableMap(extensions);
        this.fallback = ids.getOrDefault(PlainRenderer.ID, new PlainRenderer());
    }

    /**
     * Discovers all renderers registered via SPI.
     *
     * @return registry of discovered renderers
     */
    public static BodyRenderers discover() {
        ServiceLoader<BodyRenderer> loader = ServiceLoader.load(BodyRenderer.class);
        var renderers = loader.stream().map(ServiceLoader.Provider::get).toList();
        log.debug("Discovered {} body renderers", renderers.size());
        return new BodyRenderers(renderers);
    }

    /**
     * @param id renderer id
     * @return renderer with that id
     */
    public Optional<BodyRenderer> byId(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id.toLowerCase(Locale.ROOT)));
    }

    /**
     * @param extension file extension without dot
     * @return renderer claiming that extension
     */
    public Optional<BodyRenderer> byExtension(String extension) {
        return extension == null ? Optional.empty() : Optional.ofNullable(byExtension.get(extension.toLowerCase(Locale.ROOT)));
    }

    /**
     * Chooses the renderer for a source file.
     *
     * @param extension source file extension without dot
     * @param forcedId renderer id from configuration, may be null
     * @return chosen renderer, the plain renderer when nothing matches
     * @throws IllegalArgumentException if {@code forcedId} names no known renderer
     */
    public BodyRenderer select(String extension, String forcedId) {
        if (forcedId != null && !forcedId.isBlank()) {
            return byId(forcedId).orElseThrow(() ->
                new IllegalArgumentException("Unknown body renderer: " + forcedId + ". Available: " + byId.keySet()));
        }
        return byExtension(extension).orElse(fallback);
    }

    /**
     * @return the renderer used when nothing else matches
     */
    public BodyRenderer fallback() {
        return fallback;
    }

    /**
     * @return all registered renderers in discovery order
     */
    public Collection<BodyRenderer> all() {
        return byId.values();
    }

    /**
     * @return every extension some renderer claims
     */
    public Set<String> extensions() {
        return Collections.unmodifiableSet(new TreeSet<>(byExtension.keySet()));
    }
}
