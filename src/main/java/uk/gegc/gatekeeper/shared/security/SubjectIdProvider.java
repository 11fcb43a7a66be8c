package uk.gegc.gatekeeper.shared.security;

import java.util.Optional;

/**
 * Identity collaborator: yields the authenticated subject of the current call.
 */
public interface SubjectIdProvider {

    Optional<String> currentSubjectId();
}
