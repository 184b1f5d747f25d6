package org.templatize;

public class OperationCanceledException extends TemplatizeException {

    private final String stage;

    public OperationCanceledException(String stage) {
        super("Conversion canceled during " + stage);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
