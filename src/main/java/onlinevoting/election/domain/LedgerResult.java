package onlinevoting.election.domain;

/**
 * Outcome of a ledger operation that can be rejected because of caller input.
 * A successful result carries a message and a value; a failed one carries the
 * error kind and its description.
 */
public record LedgerResult<T>(
        boolean success,
        String message,
        ErrorKind errorKind,
        String error,
        T value
) {
    public static <T> LedgerResult<T> ok(T value, String message) {
        return new LedgerResult<>(true, message, null, null, value);
    }

    public static <T> LedgerResult<T> failure(ErrorKind errorKind, String error) {
        return new LedgerResult<>(false, null, errorKind, error, null);
    }

    public static <T> LedgerResult<T> invalid(String error) {
        return failure(ErrorKind.VALIDATION, error);
    }

    public static <T> LedgerResult<T> alreadyVoted() {
        return failure(ErrorKind.DUPLICATE_VOTE, "You have already voted");
    }

    public static <T> LedgerResult<T> notFound(String error) {
        return failure(ErrorKind.NOT_FOUND, error);
    }

    public boolean failed() {
        return !success;
    }
}
