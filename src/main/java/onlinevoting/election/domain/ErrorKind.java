package onlinevoting.election.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    VALIDATION("validation"),
    DUPLICATE_VOTE("duplicate_vote"),
    NOT_FOUND("not_found"),
    EMPTY_ELECTION("empty_election"),
    NO_VOTES("no_votes");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
