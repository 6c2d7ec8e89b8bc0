package onlinevoting.election.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import onlinevoting.election.domain.*;
import onlinevoting.election.dto.ElectionStateResponse;
import onlinevoting.election.ledger.ElectionLedger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serves one {@link ElectionLedger} to concurrent callers.
 *
 * Every ledger call runs under a single lock, so two requests from the same
 * voter can never both pass the already-voted check.
 */
@Service
public class ElectionService {

    private static final Logger log = LoggerFactory.getLogger(ElectionService.class);

    private final ElectionLedger ledger;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean tallyDirty = new AtomicBoolean(false);
    private final int recentVotesLimit;

    private final Counter votesAccepted;
    private final Counter candidatesRegistered;
    private final Counter resets;
    private final Map<ErrorKind, Counter> votesRejected = new EnumMap<>(ErrorKind.class);

    public ElectionService(
            ElectionLedger ledger,
            MeterRegistry meterRegistry,
            @Value("${app.state.recent-votes-limit:50}") int recentVotesLimit
    ) {
        this.ledger = ledger;
        this.recentVotesLimit = recentVotesLimit;

        this.votesAccepted = Counter.builder("election.votes.accepted")
                .description("Number of votes accepted")
                .register(meterRegistry);
        this.candidatesRegistered = Counter.builder("election.candidates.registered")
                .description("Number of candidates registered")
                .register(meterRegistry);
        this.resets = Counter.builder("election.resets")
                .description("Number of times the election was reset")
                .register(meterRegistry);
        for (ErrorKind kind : List.of(ErrorKind.VALIDATION, ErrorKind.DUPLICATE_VOTE, ErrorKind.NOT_FOUND)) {
            votesRejected.put(kind, Counter.builder("election.votes.rejected")
                    .description("Number of votes rejected")
                    .tag("reason", kind.getValue())
                    .register(meterRegistry));
        }
    }

    // Candidates

    public LedgerResult<Candidate> registerCandidate(String name, String description) {
        LedgerResult<Candidate> result = withLock(() -> ledger.registerCandidate(name, description));

        if (result.success()) {
            candidatesRegistered.increment();
            markDirty();
            log.info("Candidate registered: id={}, name={}", result.value().id(), result.value().name());
        } else {
            log.debug("Candidate registration rejected: {}", result.error());
        }
        return result;
    }

    public List<Candidate> listCandidates() {
        return withLock(ledger::listCandidates);
    }

    public Optional<Candidate> getCandidate(String candidateId) {
        return withLock(() -> ledger.getCandidate(candidateId));
    }

    // Votes

    public LedgerResult<Vote> castVote(String voterId, String candidateId) {
        LedgerResult<Vote> result = withLock(() -> ledger.castVote(voterId, candidateId));

        if (result.success()) {
            votesAccepted.increment();
            markDirty();
            log.info("Vote recorded: voter={}, candidate={}", voterId, candidateId);
        } else {
            Counter rejected = votesRejected.get(result.errorKind());
            if (rejected != null) {
                rejected.increment();
            }
            log.debug("Vote rejected ({}): voter={}, candidate={}", result.errorKind(), voterId, candidateId);
        }
        return result;
    }

    public long totalVotes() {
        return withLock(ledger::totalVotes);
    }

    public boolean hasVoted(String voterId) {
        return withLock(() -> ledger.hasVoted(voterId));
    }

    // Tallies

    public ElectionResults results() {
        return withLock(ledger::results);
    }

    public LedgerResult<ElectionOutcome> winner() {
        LedgerResult<ElectionOutcome> result = withLock(ledger::winner);
        if (result.failed()) {
            log.debug("Winner requested but unavailable: {}", result.error());
        }
        return result;
    }

    public ElectionStateResponse getElectionState(String voterId) {
        return withLock(() -> new ElectionStateResponse(
                ledger.totalVotes(),
                ledger.listCandidates(),
                ledger.results(),
                ledger.recentVotes(recentVotesLimit),
                ledger.hasVoted(voterId)
        ));
    }

    public LedgerResult<Void> reset() {
        LedgerResult<Void> result = withLock(ledger::reset);
        resets.increment();
        markDirty();
        log.info("Election reset");
        return result;
    }

    // Dirty flag for batched broadcasts

    public void markDirty() {
        tallyDirty.set(true);
    }

    public boolean isDirtyAndClear() {
        return tallyDirty.getAndSet(false);
    }

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
