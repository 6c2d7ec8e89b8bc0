package onlinevoting.election.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import onlinevoting.election.domain.*;
import onlinevoting.election.dto.*;
import onlinevoting.election.service.ElectionService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ElectionController {

    private static final Logger log = LoggerFactory.getLogger(ElectionController.class);

    private final ElectionService electionService;

    public ElectionController(ElectionService electionService) {
        this.electionService = electionService;
    }

    @PostMapping("/candidates")
    public ResponseEntity<CandidateResponse> registerCandidate(@Valid @RequestBody CandidateRequest request) {
        log.debug("Registering candidate: {}", request.name());

        LedgerResult<Candidate> result = electionService.registerCandidate(request.name(), request.description());
        HttpStatus status = result.success() ? HttpStatus.CREATED : statusFor(result.errorKind());
        return ResponseEntity.status(status).body(CandidateResponse.from(result));
    }

    @GetMapping("/candidates")
    public List<Candidate> listCandidates() {
        return electionService.listCandidates();
    }

    @GetMapping("/candidates/{candidateId}")
    public ResponseEntity<Candidate> getCandidate(@PathVariable String candidateId) {
        return electionService.getCandidate(candidateId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/votes")
    public ResponseEntity<VoteResponse> castVote(@Valid @RequestBody VoteRequest request) {
        LedgerResult<Vote> result = electionService.castVote(request.voterId(), request.candidateId());
        HttpStatus status = result.success() ? HttpStatus.CREATED : statusFor(result.errorKind());
        return ResponseEntity.status(status).body(VoteResponse.from(result));
    }

    @GetMapping("/votes/total")
    public TotalVotesResponse totalVotes() {
        return new TotalVotesResponse(electionService.totalVotes());
    }

    @GetMapping("/voters/{voterId}/voted")
    public VoterStatusResponse hasVoted(@PathVariable String voterId) {
        return new VoterStatusResponse(voterId, electionService.hasVoted(voterId));
    }

    @GetMapping("/results")
    public ElectionResults results() {
        return electionService.results();
    }

    @GetMapping("/winner")
    public ResponseEntity<WinnerResponse> winner() {
        LedgerResult<ElectionOutcome> result = electionService.winner();
        HttpStatus status = result.success() ? HttpStatus.OK : statusFor(result.errorKind());
        return ResponseEntity.status(status).body(WinnerResponse.from(result));
    }

    @GetMapping("/state")
    public ElectionStateResponse getElectionState(
            @RequestParam(required = false, defaultValue = "") String voterId
    ) {
        return electionService.getElectionState(voterId);
    }

    @PostMapping("/reset")
    public ResetResponse reset() {
        log.info("Reset requested");
        return ResetResponse.from(electionService.reset());
    }

    static HttpStatus statusFor(ErrorKind errorKind) {
        return switch (errorKind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_VOTE, EMPTY_ELECTION, NO_VOTES -> HttpStatus.CONFLICT;
        };
    }
}
