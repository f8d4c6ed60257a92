package com.shop.stockkeeper.controller;

import com.shop.stockkeeper.dto.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.net.URI;

/**
 * Maps {@link OperationResult}s onto HTTP statuses: refusals are 422, never 5xx.
 */
final class ApiResponses {

    /** Where callers land after an authorization refusal. */
    static final String NEUTRAL_PATH = "/api/items";

    private ApiResponses() {
    }

    static ResponseEntity<OperationResult> of(OperationResult result) {
        return ResponseEntity.status(result.ok() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }

    static ResponseEntity<OperationResult> created(OperationResult result) {
        return ResponseEntity.status(result.ok() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(result);
    }

    static <T> ResponseEntity<T> seeOther(String path) {
        return ResponseEntity.status(HttpStatus.SEE_OTHER).location(URI.create(path)).build();
    }
}
