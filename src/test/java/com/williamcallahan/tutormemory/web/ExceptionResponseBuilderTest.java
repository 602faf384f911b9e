package com.williamcallahan.tutormemory.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.williamcallahan.tutormemory.domain.errors.FactPersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies error and success envelopes and exception descriptions.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesTypeAndMessage() {
        assertEquals("FactPersistenceException: disk full",
                builder.describeException(new FactPersistenceException("disk full")));
        assertEquals("IllegalStateException", builder.describeException(new IllegalStateException()));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_carriesStatusAndDetails() {
        ResponseEntity<ApiErrorResponse> response = builder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to persist facts", new FactPersistenceException("disk full"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        ApiErrorResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("error", body.status());
        assertEquals("Failed to persist facts", body.message());
        assertEquals("FactPersistenceException: disk full", body.details());
    }

    @Test
    void buildSuccessResponse_isOk() {
        ResponseEntity<ApiSuccessResponse> response = builder.buildSuccessResponse("Fact deleted: f-1");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("Fact deleted: f-1", response.getBody().message());
    }
}
