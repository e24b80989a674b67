package de.bsommerfeld.modelstore.db;

/**
 * The declared schema cannot support the requested operation, e.g. an
 * identity-based operation on a table without a primary key, or a reference
 * to a column or table that was never declared. Thrown synchronously, before
 * any statement is issued.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }
}
