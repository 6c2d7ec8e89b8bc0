package onlinevoting.election.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import onlinevoting.election.BaseIntegrationTest;
import onlinevoting.election.dto.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ElectionController Integration Tests")
class ElectionControllerTest extends BaseIntegrationTest {

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToServer()
                .baseUrl("http://localhost:" + port)
                .responseTimeout(Duration.ofSeconds(10))
                .build();
    }

    private WebTestClient.ResponseSpec postVote(String voterId, String candidateId) {
        return webTestClient.post()
                .uri("/api/votes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new VoteRequest(voterId, candidateId))
                .exchange();
    }

    @Nested
    @DisplayName("POST /api/candidates - Register Candidate")
    class RegisterCandidate {

        @Test
        @DisplayName("Should register candidate with valid request")
        void shouldRegisterCandidate() {
            webTestClient.post()
                    .uri("/api/candidates")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CandidateRequest("Alice", "Party A"))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.message").isEqualTo("Candidate Alice added successfully")
                    .jsonPath("$.candidate.name").isEqualTo("Alice")
                    .jsonPath("$.candidate.description").isEqualTo("Party A")
                    .jsonPath("$.candidate.voteCount").isEqualTo(0)
                    .jsonPath("$.error").doesNotExist();
        }

        @Test
        @DisplayName("Should reject blank name with ledger validation error")
        void shouldRejectBlankName() {
            webTestClient.post()
                    .uri("/api/candidates")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CandidateRequest("   ", null))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("Candidate name is required")
                    .jsonPath("$.errorKind").isEqualTo("validation")
                    .jsonPath("$.candidate").doesNotExist();
        }

        @Test
        @DisplayName("Should reject oversized name")
        void shouldRejectOversizedName() {
            Map<String, Object> invalidRequest = new HashMap<>();
            invalidRequest.put("name", "x".repeat(101));

            webTestClient.post()
                    .uri("/api/candidates")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(invalidRequest)
                    .exchange()
                    .expectStatus().isBadRequest();

            assertThat(electionService.listCandidates()).isEmpty();
        }
    }

    @Nested
    @DisplayName("GET /api/candidates - Candidate Queries")
    class CandidateQueries {

        @Test
        @DisplayName("Should list candidates in registration order")
        void shouldListCandidates() {
            registerCandidate("Alice");
            registerCandidate("Bob");

            webTestClient.get()
                    .uri("/api/candidates")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(2)
                    .jsonPath("$[0].name").isEqualTo("Alice")
                    .jsonPath("$[1].name").isEqualTo("Bob");
        }

        @Test
        @DisplayName("Should return candidate by id")
        void shouldReturnCandidate() {
            String aliceId = registerCandidate("Alice");

            webTestClient.get()
                    .uri("/api/candidates/{candidateId}", aliceId)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.id").isEqualTo(aliceId)
                    .jsonPath("$.name").isEqualTo("Alice");
        }

        @Test
        @DisplayName("Should return 404 for unknown candidate")
        void shouldReturn404ForUnknownCandidate() {
            webTestClient.get()
                    .uri("/api/candidates/{candidateId}", "no-such-candidate")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Nested
    @DisplayName("POST /api/votes - Cast Vote")
    class CastVote {

        @Test
        @DisplayName("Should accept first vote and reject the repeat")
        void shouldRejectRepeatVoter() {
            // Given
            String aliceId = registerCandidate("Alice");
            String bobId = registerCandidate("Bob");

            // When/Then
            postVote("v1", aliceId)
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.message").isEqualTo("Vote cast successfully for Alice")
                    .jsonPath("$.vote.voterId").isEqualTo("v1")
                    .jsonPath("$.vote.candidateId").isEqualTo(aliceId)
                    .jsonPath("$.vote.timestamp").exists();

            postVote("v1", bobId)
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("You have already voted")
                    .jsonPath("$.errorKind").isEqualTo("duplicate_vote")
                    .jsonPath("$.vote").doesNotExist();

            assertThat(electionService.totalVotes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return 404 for unknown candidate")
        void shouldRejectUnknownCandidate() {
            registerCandidate("Alice");

            postVote("v1", "no-such-candidate")
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Invalid candidate ID");
        }

        @Test
        @DisplayName("Should return 400 for blank voter id")
        void shouldRejectBlankVoter() {
            String aliceId = registerCandidate("Alice");

            postVote("  ", aliceId)
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Voter ID is required");
        }

        @Test
        @DisplayName("Should report voter status and total votes")
        void shouldReportVoterStatus() {
            String aliceId = registerCandidate("Alice");
            postVote("v1", aliceId).expectStatus().isCreated();

            webTestClient.get()
                    .uri("/api/voters/{voterId}/voted", "v1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(VoterStatusResponse.class)
                    .value(response -> assertThat(response.hasVoted()).isTrue());

            webTestClient.get()
                    .uri("/api/voters/{voterId}/voted", "v2")
                    .exchange()
                    .expectBody(VoterStatusResponse.class)
                    .value(response -> assertThat(response.hasVoted()).isFalse());

            webTestClient.get()
                    .uri("/api/votes/total")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(TotalVotesResponse.class)
                    .value(response -> assertThat(response.totalVotes()).isEqualTo(1));
        }
    }

    @Nested
    @DisplayName("GET /api/results and /api/winner - Tallies")
    class Tallies {

        @Test
        @DisplayName("Should return tied results and both winners")
        void shouldReturnTie() {
            // Given
            String aliceId = registerCandidate("Alice");
            String bobId = registerCandidate("Bob");
            electionService.castVote("v1", aliceId);
            electionService.castVote("v2", bobId);

            // When/Then
            webTestClient.get()
                    .uri("/api/results")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.totalVotes").isEqualTo(2)
                    .jsonPath("$.totalCandidates").isEqualTo(2)
                    .jsonPath("$.results[0].name").isEqualTo("Alice")
                    .jsonPath("$.results[0].percentage").isEqualTo(50.0)
                    .jsonPath("$.results[1].name").isEqualTo("Bob")
                    .jsonPath("$.results[1].voteCount").isEqualTo(1);

            webTestClient.get()
                    .uri("/api/winner")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.totalVotes").isEqualTo(2)
                    .jsonPath("$.winners.length()").isEqualTo(2)
                    .jsonPath("$.winners[0].votes").isEqualTo(1)
                    .jsonPath("$.error").doesNotExist();
        }

        @Test
        @DisplayName("Should return 409 when election has no candidates")
        void shouldRejectWinnerForEmptyElection() {
            webTestClient.get()
                    .uri("/api/winner")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("No candidates in the election")
                    .jsonPath("$.winners").doesNotExist();
        }

        @Test
        @DisplayName("Should return 409 when no votes were cast")
        void shouldRejectWinnerWithoutVotes() {
            registerCandidate("Alice");

            webTestClient.get()
                    .uri("/api/winner")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.errorKind").isEqualTo("no_votes");
        }
    }

    @Nested
    @DisplayName("GET /api/state and POST /api/reset")
    class StateAndReset {

        @Test
        @DisplayName("Should return election state for a voter")
        void shouldReturnState() {
            String aliceId = registerCandidate("Alice");
            electionService.castVote("v1", aliceId);

            webTestClient.get()
                    .uri("/api/state?voterId={voterId}", "v1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.totalVotes").isEqualTo(1)
                    .jsonPath("$.hasVoted").isEqualTo(true)
                    .jsonPath("$.candidates[0].name").isEqualTo("Alice")
                    .jsonPath("$.recentVotes[0].voterId").isEqualTo("v1");
        }

        @Test
        @DisplayName("Should work without voter id")
        void shouldWorkWithoutVoterId() {
            webTestClient.get()
                    .uri("/api/state")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.hasVoted").isEqualTo(false);
        }

        @Test
        @DisplayName("Should reset the election")
        void shouldReset() {
            String aliceId = registerCandidate("Alice");
            electionService.castVote("v1", aliceId);

            webTestClient.post()
                    .uri("/api/reset")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(ResetResponse.class)
                    .value(response -> {
                        assertThat(response.success()).isTrue();
                        assertThat(response.message()).isEqualTo("Voting system has been reset");
                    });

            assertThat(electionService.totalVotes()).isZero();
            assertThat(electionService.listCandidates()).isEmpty();
            assertThat(electionService.hasVoted("v1")).isFalse();
        }
    }
}
