package onlinevoting.election.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import onlinevoting.election.domain.Candidate;
import onlinevoting.election.domain.ErrorKind;
import onlinevoting.election.domain.LedgerResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateResponse(
        boolean success,
        String message,
        String error,
        ErrorKind errorKind,
        Candidate candidate
) {
    public static CandidateResponse from(LedgerResult<Candidate> result) {
        return new CandidateResponse(
                result.success(), result.message(), result.error(), result.errorKind(), result.value()
        );
    }
}
