package uk.gegc.gatekeeper.features.catalog.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Roles or permissions were added to or changed in the provisioned catalog.
 */
@Getter
public class CatalogChangedEvent extends ApplicationEvent {

    private final String reason;

    public CatalogChangedEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }
}
