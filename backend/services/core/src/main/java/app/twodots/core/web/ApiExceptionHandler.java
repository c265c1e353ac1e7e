package app.twodots.core.web;

import app.twodots.core.resolution.service.NodeResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(SecurityException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleForbidden(SecurityException e) {
        return body("FORBIDDEN", e.getMessage());
    }

    @ExceptionHandler(NodeResolutionException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleResolutionFailure(NodeResolutionException e) {
        log.error("Node resolution failed", e);
        return body("RESOLUTION_FAILED", e.getMessage());
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of(
                "error", error,
                "message", message == null ? "" : message
        );
    }
}
