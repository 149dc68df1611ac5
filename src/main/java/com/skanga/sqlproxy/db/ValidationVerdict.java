package com.skanga.sqlproxy.db;

/**
 * Outcome of validating a piece of query text.
 *
 * @param accepted Whether the text may be executed
 * @param reason   Why the text was rejected, null when accepted
 */
public record ValidationVerdict(boolean accepted, String reason) {
    private static final ValidationVerdict ACCEPTED = new ValidationVerdict(true, null);

    public static ValidationVerdict accept() {
        return ACCEPTED;
    }

    public static ValidationVerdict reject(String reason) {
        return new ValidationVerdict(false, reason);
    }

    public boolean rejected() {
        return !accepted;
    }

    /**
     * @throws QueryValidationException carrying the rejection reason, if this verdict is a rejection
     */
    public void throwIfRejected() throws QueryValidationException {
        if (!accepted) {
            throw new QueryValidationException(reason);
        }
    }
}
