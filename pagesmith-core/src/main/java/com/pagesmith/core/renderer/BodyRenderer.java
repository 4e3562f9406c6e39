package com.pagesmith.core.renderer;

import java.util.Set;

/**
 * Interface for renderers that turn the body text of a page into HTML.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI) and chosen
 * per page, either by id from configuration or by source file extension.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ShoutRenderer implements BodyRenderer {
 *     @Override
 *     public String getId() {
 *         return "shout";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Shouting Renderer";
 *     }
 *
 *     @Override
 *     public Set<String> getExtensions() {
 *         return Set.of("shout");
 *     }
 *
 *     @Override
 *     public String render(String text) {
 *         return "<p>" + text.toUpperCase() + "</p>";
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pagesmith.core.renderer.BodyRenderer}
 *
 * <p>Implementations must be stateless or thread-safe; one instance renders every
 * page of a build.
 *
 * @see BodyRenderers
 */
public interface BodyRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for referencing the renderer in configuration. Should be lowercase
     * (e.g., "plain", "markdown").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this renderer.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the source file extensions this renderer handles by default.
     *
     * @return lowercase extensions without leading dot
     */
    Set<String> getExtensions();

    /**
     * Renders body text to HTML.
     *
     * @param text raw body text, never null
     * @return HTML fragment
     */
    String render(String text);
}
