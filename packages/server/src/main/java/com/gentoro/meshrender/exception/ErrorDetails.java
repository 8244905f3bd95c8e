package com.gentoro.meshrender.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error information suitable for logging or JSON error responses. */
public record ErrorDetails(
    String type,
    String message,
    MeshRenderErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
