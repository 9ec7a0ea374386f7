package com.oitracker.exception;

import java.util.Map;

/**
 * Thrown when raw venue data cannot form a valid snapshot (missing timestamp,
 * non-positive spot, negative OI or volume).
 *
 * <p>Only raised at the snapshot boundary. The tick processor treats it as "skip this
 * tick"; nothing past the boundary sees malformed data.
 */
public class InvalidSnapshotException extends BaseException {

    public InvalidSnapshotException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
