package me.golemcore.pulse.domain.exception;

/**
 * Reference to an unknown message, action, rule, workflow, run or approval.
 */
public class NotFoundException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String entity;
    private final String entityId;

    public NotFoundException(String entity, String entityId) {
        super(entity + " not found: " + entityId);
        this.entity = entity;
        this.entityId = entityId;
    }

    public String getEntity() {
        return entity;
    }

    public String getEntityId() {
        return entityId;
    }
}
