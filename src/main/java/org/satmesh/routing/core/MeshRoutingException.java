package org.satmesh.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Mesh routing contract exception with deterministic reason codes.
 * <p>
 * Reason codes are the {@code REASON_*} constants on {@link SatelliteMesh}.
 * </p>
 */
@Getter
public final class MeshRoutingException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded mesh contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MeshRoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded mesh contract failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public MeshRoutingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
