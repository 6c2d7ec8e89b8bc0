package onlinevoting.election.domain;

import java.time.Instant;

public record Vote(
        String voterId,
        String candidateId,
        Instant timestamp
) {
    public static Vote create(String voterId, String candidateId) {
        return new Vote(voterId, candidateId, Instant.now());
    }
}
