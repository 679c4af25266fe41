package uk.gegc.questionbank.shared.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Supplies the opaque user id used to build user-scoped namespaces.
 */
@Component
public class CurrentUserResolver {

    /**
     * @return the authenticated principal's name, or {@code null} for anonymous callers
     */
    public String resolveUserId(Authentication authentication) {
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        String name = authentication.getName();
        return name == null || name.isBlank() ? null : name;
    }
}
