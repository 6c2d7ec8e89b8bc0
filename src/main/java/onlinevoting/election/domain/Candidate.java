package onlinevoting.election.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A registered candidate. Instances are immutable; the ledger replaces the
 * stored instance with {@link #withVote()} when a vote is accepted.
 */
public record Candidate(
        String id,
        String name,
        String description,
        long voteCount
) {
    public static final int PERCENTAGE_SCALE = 2;

    public Candidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        if (description == null) {
            description = "";
        }
        if (voteCount < 0) {
            throw new IllegalArgumentException("Vote count must not be negative: " + voteCount);
        }
    }

    public static Candidate create(String id, String name, String description) {
        return new Candidate(id, name, description, 0);
    }

    public Candidate withVote() {
        return new Candidate(id, name, description, voteCount + 1);
    }

    /**
     * Share of {@code totalVotes} held by this candidate, in percent, rounded half-up
     * to two decimals. Zero when no votes have been cast.
     */
    public BigDecimal percentageOf(long totalVotes) {
        if (totalVotes == 0) {
            return BigDecimal.ZERO.setScale(PERCENTAGE_SCALE);
        }
        return BigDecimal.valueOf(voteCount)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalVotes), PERCENTAGE_SCALE, RoundingMode.HALF_UP);
    }
}
