package com.z254.secretsync.core.template;

/**
 * A template could not be registered or rendered.
 */
public class TemplateException extends RuntimeException {

    private final String templateName;

    public TemplateException(String templateName, String message) {
        super("template " + templateName + ": " + message);
        this.templateName = templateName;
    }

    public TemplateException(String templateName, String message, Throwable cause) {
        super("template " + templateName + ": " + message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
