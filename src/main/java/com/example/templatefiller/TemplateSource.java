package com.example.templatefiller;

/** Where template packages come from. */
public interface TemplateSource {

    /**
     * @throws TemplateNotFoundException when no template is stored under {@code key}
     */
    byte[] fetch(String key);
}
