package app.twodots.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app.cors")
public record CorsProps(
        List<String> origins,
        List<String> methods,
        Duration maxAge
) {
    private static final List<String> DEFAULT_ORIGINS = List.of("http://localhost:3000");
    private static final List<String> DEFAULT_METHODS = List.of("GET", "POST", "DELETE", "OPTIONS");

    public CorsProps {
        origins = (origins == null || origins.isEmpty()) ? DEFAULT_ORIGINS : List.copyOf(origins);
        methods = (methods == null || methods.isEmpty()) ? DEFAULT_METHODS : List.copyOf(methods);
        maxAge = maxAge == null ? Duration.ofHours(1) : maxAge;
    }
}
