package uk.gegc.gatekeeper.features.assignment.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * A role grant/revoke or team membership change touched this subject.
 */
@Getter
public class SubjectAssignmentsChangedEvent extends ApplicationEvent {

    private final String subjectId;
    private final ChangeType changeType;

    public SubjectAssignmentsChangedEvent(Object source, String subjectId, ChangeType changeType) {
        super(source);
        this.subjectId = subjectId;
        this.changeType = changeType;
    }

    public enum ChangeType {
        ROLE_GRANTED,
        ROLE_REVOKED,
        TEAM_JOINED,
        TEAM_LEFT
    }
}
