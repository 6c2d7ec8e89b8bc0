package onlinevoting.election.dto;

import onlinevoting.election.domain.Candidate;
import onlinevoting.election.domain.ElectionResults;
import onlinevoting.election.domain.Vote;

import java.util.List;

/**
 * Everything a (re)connecting client needs to rebuild its view in one call.
 */
public record ElectionStateResponse(
        long totalVotes,
        List<Candidate> candidates,
        ElectionResults results,
        List<Vote> recentVotes,
        boolean hasVoted
) {}
