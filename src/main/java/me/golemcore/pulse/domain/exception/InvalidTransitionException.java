package me.golemcore.pulse.domain.exception;

/**
 * Out-of-order state change, e.g. approving an action that is no longer
 * PENDING_APPROVAL. Nothing is mutated when this is thrown.
 */
public class InvalidTransitionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String from;
    private final String to;

    public InvalidTransitionException(String entity, String id, Enum<?> from, Enum<?> to) {
        super("Cannot move " + entity + " " + id + " from " + from + " to " + to);
        this.from = String.valueOf(from);
        this.to = String.valueOf(to);
    }

    public InvalidTransitionException(String message) {
        super(message);
        this.from = null;
        this.to = null;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
