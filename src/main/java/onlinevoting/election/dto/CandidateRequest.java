package onlinevoting.election.dto;

import jakarta.validation.constraints.Size;

public record CandidateRequest(
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Size(max = 500, message = "Description must be at most 500 characters")
        String description  // Optional
) {
    public CandidateRequest {
        if (description == null) {
            description = "";
        }
    }
}
