package uk.gegc.gatekeeper.shared.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the subject id from the Spring Security context. The authentication
 * name is used as the subject id; anonymous and unauthenticated callers have none.
 */
@Component
public class SecurityContextSubjectIdProvider implements SubjectIdProvider {

    @Override
    public Optional<String> currentSubjectId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return Optional.empty();
        }
        String name = authentication.getName();
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
    }
}
