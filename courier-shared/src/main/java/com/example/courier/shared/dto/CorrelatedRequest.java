package com.example.courier.shared.dto;

/**
 * Implemented by request bodies that may carry a caller-supplied correlation id.
 */
public interface CorrelatedRequest {
    String getCorrelationId();
}
