package me.golemcore.pulse.domain.exception;

/**
 * Attempt to execute an action that requires approval but has not been
 * approved.
 */
public class ApprovalRequiredException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String actionId;

    public ApprovalRequiredException(String actionId) {
        super("Action " + actionId + " requires approval before execution");
        this.actionId = actionId;
    }

    public String getActionId() {
        return actionId;
    }
}
