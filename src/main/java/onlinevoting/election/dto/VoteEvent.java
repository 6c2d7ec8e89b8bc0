package onlinevoting.election.dto;

import onlinevoting.election.domain.Candidate;
import onlinevoting.election.domain.Vote;

import java.time.Instant;

/**
 * Individual accepted vote, broadcast to all subscribers.
 */
public record VoteEvent(
        String voterId,
        String candidateId,
        String candidateName,
        Instant timestamp
) {
    public static VoteEvent of(Vote vote, Candidate candidate) {
        return new VoteEvent(vote.voterId(), candidate.id(), candidate.name(), vote.timestamp());
    }
}
