package com.wrestling.ratings.exception;

import com.wrestling.ratings.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class GlobalExceptionHandlerTest {

    GlobalExceptionHandler handler;
    HttpServletRequest request;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        request = mock(HttpServletRequest.class);
        when(request.getRequestURI()).thenReturn("/api/leaderboards/run");
    }

    @Test
    void notFound_is404() {
        ResponseEntity<ApiError> response = handler.handleNotFound(ResourceNotFoundException.noLeaderboard(), request);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("NOT_FOUND", response.getBody().code());
        assertEquals("/api/leaderboards/run", response.getBody().path());
    }

    @Test
    void illegalArgument_is400() {
        ResponseEntity<ApiError> response = handler.handleIllegalArgument(
                new IllegalArgumentException("tau must be positive: 0.0"), request);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("tau must be positive: 0.0", response.getBody().message());
    }

    @Test
    void convergenceFailure_is500WithItsOwnCode() {
        ResponseEntity<ApiError> response = handler.handleConvergence(
                new RatingConvergenceException("Could not bracket volatility root"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("RATING_CONVERGENCE", response.getBody().code());
    }

    @Test
    void anythingElse_isAGeneric500() {
        ResponseEntity<ApiError> response = handler.handleGeneral(new IllegalStateException("boom"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().code());
        assertEquals("An unexpected error occurred", response.getBody().message());
    }
}
