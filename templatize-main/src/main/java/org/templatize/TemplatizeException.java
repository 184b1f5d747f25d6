package org.templatize;

public class TemplatizeException extends RuntimeException {

    public TemplatizeException(String message) {
        super(message);
    }

    public TemplatizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
