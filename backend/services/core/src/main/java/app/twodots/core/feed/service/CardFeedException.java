package app.twodots.core.feed.service;

public class CardFeedException extends RuntimeException {

    public CardFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
