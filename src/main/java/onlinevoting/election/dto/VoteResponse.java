package onlinevoting.election.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import onlinevoting.election.domain.ErrorKind;
import onlinevoting.election.domain.LedgerResult;
import onlinevoting.election.domain.Vote;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VoteResponse(
        boolean success,
        String message,
        String error,
        ErrorKind errorKind,
        Vote vote
) {
    public static VoteResponse from(LedgerResult<Vote> result) {
        return new VoteResponse(
                result.success(), result.message(), result.error(), result.errorKind(), result.value()
        );
    }
}
