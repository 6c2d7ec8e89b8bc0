package onlinevoting.election.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import onlinevoting.election.domain.ElectionOutcome;
import onlinevoting.election.domain.ErrorKind;
import onlinevoting.election.domain.LedgerResult;
import onlinevoting.election.domain.Winner;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WinnerResponse(
        boolean success,
        List<Winner> winners,
        Long totalVotes,
        String error,
        ErrorKind errorKind
) {
    public static WinnerResponse from(LedgerResult<ElectionOutcome> result) {
        if (result.failed()) {
            return new WinnerResponse(false, null, null, result.error(), result.errorKind());
        }
        ElectionOutcome outcome = result.value();
        return new WinnerResponse(true, outcome.winners(), outcome.totalVotes(), null, null);
    }
}
