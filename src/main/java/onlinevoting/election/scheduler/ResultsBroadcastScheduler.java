package onlinevoting.election.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import onlinevoting.election.domain.ElectionResults;
import onlinevoting.election.service.ElectionService;
import onlinevoting.election.websocket.Destinations;

/**
 * Pushes the tally to subscribers at a fixed rate, only when it changed since
 * the previous push.
 */
@Component
public class ResultsBroadcastScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResultsBroadcastScheduler.class);

    private final ElectionService electionService;
    private final SimpMessagingTemplate messagingTemplate;

    public ResultsBroadcastScheduler(
            ElectionService electionService,
            SimpMessagingTemplate messagingTemplate
    ) {
        this.electionService = electionService;
        this.messagingTemplate = messagingTemplate;
    }

    @Scheduled(fixedRateString = "${app.broadcast.interval-ms:2000}")
    public void broadcastResults() {
        if (!electionService.isDirtyAndClear()) {
            return;
        }

        ElectionResults results = electionService.results();
        messagingTemplate.convertAndSend(Destinations.RESULTS, results);
        log.trace("Broadcast results: totalVotes={}, candidates={}",
                results.totalVotes(), results.totalCandidates());
    }
}
