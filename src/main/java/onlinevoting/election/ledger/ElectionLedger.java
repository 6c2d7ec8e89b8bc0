package onlinevoting.election.ledger;

import onlinevoting.election.domain.*;

import java.util.*;

/**
 * In-memory record of one election: registered candidates, accepted votes and
 * the voters who cast them.
 *
 * A voter id is in the voted set if and only if exactly one accepted vote
 * carries it, and the candidates' vote counts always sum to the number of
 * accepted votes.
 *
 * Not thread-safe. Hosts that call it from several threads must serialize
 * every operation behind one lock (see {@code ElectionService}).
 */
public class ElectionLedger {

    public static final String DEFAULT_ID_PREFIX = "candidate_";

    private final String idPrefix;

    // Insertion order is registration order
    private final Map<String, Candidate> candidates = new LinkedHashMap<>();
    private final List<Vote> votes = new ArrayList<>();
    private final Set<String> voters = new HashSet<>();

    public ElectionLedger() {
        this(DEFAULT_ID_PREFIX);
    }

    public ElectionLedger(String idPrefix) {
        this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix");
    }

    // Candidates

    public LedgerResult<Candidate> registerCandidate(String name) {
        return registerCandidate(name, "");
    }

    public LedgerResult<Candidate> registerCandidate(String name, String description) {
        if (isBlank(name)) {
            return LedgerResult.invalid("Candidate name is required");
        }

        String trimmedName = name.trim();
        Candidate candidate = Candidate.create(nextCandidateId(), trimmedName, description);
        candidates.put(candidate.id(), candidate);

        return LedgerResult.ok(candidate, "Candidate " + trimmedName + " added successfully");
    }

    public List<Candidate> listCandidates() {
        return List.copyOf(candidates.values());
    }

    public Optional<Candidate> getCandidate(String candidateId) {
        if (candidateId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(candidates.get(candidateId));
    }

    // Votes

    /**
     * Records one vote. Checks run in a fixed order: blank voter id, then repeat
     * voter, then unknown candidate. A repeat voter is rejected as such even when
     * the candidate id is unknown.
     */
    public LedgerResult<Vote> castVote(String voterId, String candidateId) {
        if (isBlank(voterId)) {
            return LedgerResult.invalid("Voter ID is required");
        }

        if (voters.contains(voterId)) {
            return LedgerResult.alreadyVoted();
        }

        Optional<Candidate> candidateOpt = getCandidate(candidateId);
        if (candidateOpt.isEmpty()) {
            return LedgerResult.notFound("Invalid candidate ID");
        }

        Candidate candidate = candidateOpt.get();
        Vote vote = Vote.create(voterId, candidate.id());

        // Nothing below can fail, so the three updates land together
        votes.add(vote);
        candidates.put(candidate.id(), candidate.withVote());
        voters.add(voterId);

        return LedgerResult.ok(vote, "Vote cast successfully for " + candidate.name());
    }

    public long totalVotes() {
        return votes.size();
    }

    public boolean hasVoted(String voterId) {
        return voterId != null && voters.contains(voterId);
    }

    /**
     * The last {@code limit} accepted votes, oldest first.
     */
    public List<Vote> recentVotes(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, votes.size() - limit);
        return List.copyOf(votes.subList(from, votes.size()));
    }

    // Tallies

    public ElectionResults results() {
        long total = totalVotes();
        List<CandidateTally> tallies = candidates.values().stream()
                .map(candidate -> CandidateTally.of(candidate, total))
                // Stable sort keeps registration order among equal counts
                .sorted(Comparator.comparingLong(CandidateTally::voteCount).reversed())
                .toList();

        return new ElectionResults(total, candidates.size(), tallies);
    }

    public LedgerResult<ElectionOutcome> winner() {
        if (candidates.isEmpty()) {
            return LedgerResult.failure(ErrorKind.EMPTY_ELECTION, "No candidates in the election");
        }

        long total = totalVotes();
        if (total == 0) {
            return LedgerResult.failure(ErrorKind.NO_VOTES, "No votes cast yet");
        }

        long maxVotes = candidates.values().stream()
                .mapToLong(Candidate::voteCount)
                .max()
                .orElse(0);

        List<Winner> winners = candidates.values().stream()
                .filter(candidate -> candidate.voteCount() == maxVotes)
                .map(Winner::from)
                .toList();

        String message = winners.size() == 1
                ? "Winner: " + winners.get(0).name()
                : "Tie between " + winners.size() + " candidates";
        return LedgerResult.ok(new ElectionOutcome(winners, total), message);
    }

    // Reset

    public LedgerResult<Void> reset() {
        candidates.clear();
        votes.clear();
        voters.clear();
        return LedgerResult.ok(null, "Voting system has been reset");
    }

    private String nextCandidateId() {
        String id;
        do {
            id = idPrefix + UUID.randomUUID();
        } while (candidates.containsKey(id));
        return id;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
