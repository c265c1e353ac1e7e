package app.twodots.core.feed.service;

public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message) {
        super(message);
    }
}
