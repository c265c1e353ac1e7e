package app.twodots.core.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class CurrentUserProvider {

    public UUID getUserId(Jwt jwt) {
        if (jwt == null) {
            throw new SecurityException("Authentication required");
        }
        String claim = jwt.getClaimAsString("user_id");
        if (claim == null) {
            throw new IllegalStateException("JWT does not contain 'user_id' claim");
        }
        try {
            return UUID.fromString(claim);
        } catch (IllegalArgumentException ex) {
            throw new SecurityException("Malformed 'user_id' claim");
        }
    }
}
