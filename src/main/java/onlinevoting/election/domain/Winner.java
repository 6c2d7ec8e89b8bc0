package onlinevoting.election.domain;

public record Winner(
        String id,
        String name,
        long votes
) {
    public static Winner from(Candidate candidate) {
        return new Winner(candidate.id(), candidate.name(), candidate.voteCount());
    }
}
