package org.templatize;

public class TemplatizeConfigurationException extends TemplatizeException {

    private final String key;
    private final String value;

    public TemplatizeConfigurationException(String key, String value, String reason) {
        super("Invalid value '" + value + "' for '" + key + "': " + reason);
        this.key = key;
        this.value = value;
    }

    public TemplatizeConfigurationException(String key, String value, Throwable cause) {
        super("Invalid value '" + value + "' for '" + key + "'", cause);
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }
}
