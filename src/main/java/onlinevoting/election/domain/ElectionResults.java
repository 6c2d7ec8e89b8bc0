package onlinevoting.election.domain;

import java.util.List;

public record ElectionResults(
        long totalVotes,
        int totalCandidates,
        List<CandidateTally> results
) {}
