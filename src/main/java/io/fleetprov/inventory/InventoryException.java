package io.fleetprov.inventory;

/**
 * The target list is missing, malformed or inconsistent. Raised before any job
 * exists; aborts the whole run.
 */
public final class InventoryException extends RuntimeException {
    public InventoryException(String message) {
        super(message);
    }

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
