package onlinevoting.election.dto;

public record VoterStatusResponse(
        String voterId,
        boolean hasVoted
) {}
