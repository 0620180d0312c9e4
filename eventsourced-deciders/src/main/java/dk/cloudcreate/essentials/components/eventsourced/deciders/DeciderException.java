package dk.cloudcreate.essentials.components.eventsourced.deciders;

/**
 * Root of all exceptions raised by, or routed through, the decider components
 */
public class DeciderException extends RuntimeException {
    public DeciderException(String message) {
        super(message);
    }
}
