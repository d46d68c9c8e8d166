package me.internalizable.modmanager.ledger;

/**
 * Thrown when the ledger file cannot be read or written.
 *
 * <p>A ledger whose content cannot be decoded is not an error; it is moved
 * aside and replaced by an empty one.</p>
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
