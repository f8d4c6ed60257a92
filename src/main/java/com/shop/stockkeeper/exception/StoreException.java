package com.shop.stockkeeper.exception;

/**
 * The store could not be opened, migrated or no longer matches the mapped
 * schema. Never used for business-rule refusals.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
