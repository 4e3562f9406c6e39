package com.pagesmith.core.exception;

/**
 * Thrown when the template engine cannot resolve a template name.
 */
public class TemplateNotFoundException extends PageException {

    private final String templateName;

    public TemplateNotFoundException(String templateName, String location) {
        super("Template not found: " + templateName + " (looked in " + location + ")");
        this.templateName = templateName;
    }

    public TemplateNotFoundException(String templateName, String location, Throwable cause) {
        super("Template not found: " + templateName + " (looked in " + location + ")", cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
