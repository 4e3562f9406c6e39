package com.pagesmith.core.template;

import java.util.Map;

/**
 * A compiled page template.
 */
public interface Template {

    /**
     * @return template name without extension
     */
    String getName();

    /**
     * Renders the template.
     *
     * @param variables template variables
     * @return rendered markup
     */
    String render(Map<String, Object> variables);
}
