package onlinevoting.election.domain;

import java.util.List;

/**
 * Winner(s) of the election. More than one entry means a tie on the top vote count.
 */
public record ElectionOutcome(
        List<Winner> winners,
        long totalVotes
) {
    public boolean isTie() {
        return winners.size() > 1;
    }
}
