package app.twodots.core.resolution.service;

public class NodeResolutionException extends RuntimeException {

    public NodeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
