package org.kube.solving.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Solver contract exception with deterministic reason codes.
 *
 * <p>Failures raised while a reduction phase runs also carry that phase's name; request
 * and verification failures carry none.</p>
 */
@Getter
public final class SolveCoreException extends RuntimeException {
    private final String reasonCode;
    /** Name of the failing reduction phase, or {@code null} outside the phases. */
    private final String phaseName;

    /**
     * Creates a reason-coded solver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public SolveCoreException(String reasonCode, String message) {
        this(reasonCode, null, message, null);
    }

    /**
     * Creates a reason-coded solver failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public SolveCoreException(String reasonCode, String message, Throwable cause) {
        this(reasonCode, null, message, cause);
    }

    private SolveCoreException(String reasonCode, String phaseName, String message, Throwable cause) {
        super(formatMessage(reasonCode, phaseName, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.phaseName = phaseName;
    }

    /**
     * Creates a failure raised by one reduction phase; the message reads {@code [CODE] PHASE: message}.
     *
     * @param reasonCode deterministic reason code.
     * @param phaseName name of the failing phase.
     * @param message descriptive error message.
     */
    static SolveCoreException inPhase(String reasonCode, String phaseName, String message) {
        return new SolveCoreException(reasonCode, Objects.requireNonNull(phaseName, "phaseName"), message, null);
    }

    private static String formatMessage(String reasonCode, String phaseName, String message) {
        String prefix = "[" + requireReasonCode(reasonCode) + "] ";
        if (phaseName != null) {
            prefix += phaseName + ": ";
        }
        return prefix + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
