package com.paydispatch.transport.model;

public record ServiceHealthResponse(
        Boolean failing,
        Integer minResponseTime
) {
}
