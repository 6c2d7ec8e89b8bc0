package onlinevoting.election.websocket;

/**
 * STOMP destinations shared by the broker config, controllers and schedulers.
 */
public final class Destinations {

    public static final String APP_PREFIX = "/app";
    public static final String TOPIC_PREFIX = "/topic";

    public static final String VOTE = "/vote";
    public static final String VOTE_RESPONSE = TOPIC_PREFIX + "/vote-response";
    public static final String VOTE_EVENTS = TOPIC_PREFIX + "/vote-events";
    public static final String RESULTS = TOPIC_PREFIX + "/results";

    private Destinations() {
    }
}
