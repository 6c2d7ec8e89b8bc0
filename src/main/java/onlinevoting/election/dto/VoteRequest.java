package onlinevoting.election.dto;

import jakarta.validation.constraints.Size;

/**
 * Blank ids are let through so the ledger reports them with its own error.
 */
public record VoteRequest(
        @Size(max = 128, message = "Voter ID must be at most 128 characters")
        String voterId,

        @Size(max = 128, message = "Candidate ID must be at most 128 characters")
        String candidateId
) {}
