package onlinevoting.election.dto;

import onlinevoting.election.domain.LedgerResult;

public record ResetResponse(
        boolean success,
        String message
) {
    public static ResetResponse from(LedgerResult<Void> result) {
        return new ResetResponse(result.success(), result.message());
    }
}
