package com.tracegate.core.policy;

/**
 * Result of checking an artifact's anchor against its layer's policy.
 *
 * @param message empty for {@code ok}; actionable text otherwise
 */
public record ValidationOutcome(ValidationStatus status, String message) {

    public static ValidationOutcome ok() {
        return new ValidationOutcome(ValidationStatus.OK, "");
    }

    public static ValidationOutcome warn(String message) {
        return new ValidationOutcome(ValidationStatus.WARN, message);
    }

    public static ValidationOutcome reject(String message) {
        return new ValidationOutcome(ValidationStatus.REJECT, message);
    }

    public boolean isRejected() {
        return status == ValidationStatus.REJECT;
    }
}
