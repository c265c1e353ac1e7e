package app.twodots.core.resolution.domain;

import java.util.List;

public record CacheStats(
        int size,
        List<String> keys
) {
}
