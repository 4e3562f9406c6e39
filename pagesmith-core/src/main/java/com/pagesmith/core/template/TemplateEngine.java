package com.pagesmith.core.template;

import com.pagesmith.core.exception.TemplateNotFoundException;

/**
 * Resolves page templates by name.
 *
 * <p>One engine is created per build and shared by every page, so implementations
 * must be thread-safe.
 */
public interface TemplateEngine {

    /** Template used for pages that do not name a {@code type}. */
    String DEFAULT_TEMPLATE = "default";

    /**
     * Looks up a template.
     *
     * @param name template name, usually the page {@code type}
     * @return compiled template
     * @throws TemplateNotFoundException if no template has that name
     */
    Template getTemplate(String name);
}
