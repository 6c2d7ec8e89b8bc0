package onlinevoting.election.dto;

public record TotalVotesResponse(
        long totalVotes
) {}
