package com.proofmill.witness.processor;

import com.proofmill.witness.model.FailureKind;

/**
 * A job attempt failed for a reason the engine can classify.
 *
 * Unchecked so stages only throw it where they know the failure kind; every
 * other exception reaching the engine is classified there.
 */
public class WitnessGenerationException extends RuntimeException {

    private final FailureKind kind;

    public WitnessGenerationException(FailureKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public WitnessGenerationException(FailureKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public static WitnessGenerationException inputContractViolation(String message) {
        return new WitnessGenerationException(FailureKind.INPUT_CONTRACT_VIOLATION, message);
    }

    public FailureKind getKind() { return kind; }
}
