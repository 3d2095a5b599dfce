package app.threejs.catalog.support;

public class SketchfabException extends RuntimeException {

    private final FailureKind kind;

    public SketchfabException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SketchfabException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
