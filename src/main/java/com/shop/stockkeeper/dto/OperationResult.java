package com.shop.stockkeeper.dto;

/**
 * Outcome of a business operation. Refusals travel as {@code ok = false} with a
 * message meant for the person at the counter.
 */
public record OperationResult(boolean ok, String message) {

    public static OperationResult success(String message) {
        return new OperationResult(true, message);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message);
    }
}
