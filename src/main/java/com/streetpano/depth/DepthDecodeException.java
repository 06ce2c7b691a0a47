package com.streetpano.depth;

/**
 * The encoded depth blob violates the expected layout at a given stage.
 */
public class DepthDecodeException extends Exception {

    public enum Stage {BASE64, INFLATE, HEADER, LABELS, PLANES}

    private final Stage stage;

    public DepthDecodeException(Stage stage, String reason) {
        super(stage.name().toLowerCase() + ": " + reason);
        this.stage = stage;
    }

    public DepthDecodeException(Stage stage, String reason, Throwable cause) {
        super(stage.name().toLowerCase() + ": " + reason, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
