package com.docstore.core;

public class ConfigurationException extends DocumentStoreException {
    private final String field;

    public ConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
