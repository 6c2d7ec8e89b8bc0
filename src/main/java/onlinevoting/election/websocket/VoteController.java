package onlinevoting.election.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;
import onlinevoting.election.domain.LedgerResult;
import onlinevoting.election.domain.Vote;
import onlinevoting.election.dto.VoteEvent;
import onlinevoting.election.dto.VoteRequest;
import onlinevoting.election.dto.VoteResponse;
import onlinevoting.election.service.ElectionService;

@Controller
public class VoteController {

    private static final Logger log = LoggerFactory.getLogger(VoteController.class);

    private final ElectionService electionService;
    private final SimpMessagingTemplate messagingTemplate;

    public VoteController(ElectionService electionService, SimpMessagingTemplate messagingTemplate) {
        this.electionService = electionService;
        this.messagingTemplate = messagingTemplate;
    }

    @MessageMapping(Destinations.VOTE)
    @SendTo(Destinations.VOTE_RESPONSE)
    public VoteResponse vote(VoteRequest request) {
        log.debug("Vote received over STOMP: voter={}, candidate={}",
                request.voterId(), request.candidateId());

        LedgerResult<Vote> result = electionService.castVote(request.voterId(), request.candidateId());

        if (result.success()) {
            Vote vote = result.value();
            electionService.getCandidate(vote.candidateId()).ifPresent(candidate -> {
                messagingTemplate.convertAndSend(Destinations.VOTE_EVENTS, VoteEvent.of(vote, candidate));
                log.debug("Broadcast vote event: voter={}, candidate={}", vote.voterId(), candidate.name());
            });
        }

        return VoteResponse.from(result);
    }
}
