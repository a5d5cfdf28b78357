package com.example.templatefiller;

public class TemplateNotFoundException extends TemplateFillException {
    private final String key;

    public TemplateNotFoundException(String key, Throwable cause) {
        super("Template not found: " + key, cause);
        this.key = key;
    }

    public String getKey() { return key; }
}
