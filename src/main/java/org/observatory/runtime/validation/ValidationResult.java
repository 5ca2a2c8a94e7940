package org.observatory.runtime.validation;

/**
 * Outcome of validating one action.
 *
 * @param reason {@code null} when accepted
 * @param detail short explanation for diagnostics, {@code null} when accepted
 */
public record ValidationResult(RejectionReason reason, String detail) {

    private static final ValidationResult ACCEPTED = new ValidationResult(null, null);

    public static ValidationResult accept() {
        return ACCEPTED;
    }

    public static ValidationResult reject(RejectionReason reason, String detail) {
        return new ValidationResult(reason, detail);
    }

    public boolean isAccepted() {
        return reason == null;
    }
}
