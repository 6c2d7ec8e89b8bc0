package onlinevoting.election.domain;

import java.math.BigDecimal;

public record CandidateTally(
        String id,
        String name,
        long voteCount,
        BigDecimal percentage
) {
    public static CandidateTally of(Candidate candidate, long totalVotes) {
        return new CandidateTally(
                candidate.id(),
                candidate.name(),
                candidate.voteCount(),
                candidate.percentageOf(totalVotes)
        );
    }
}
