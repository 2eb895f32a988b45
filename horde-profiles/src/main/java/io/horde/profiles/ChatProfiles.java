package io.horde.profiles;

import io.horde.api.classify.ClassificationPolicy;
import io.horde.api.classify.Verdict;
import io.horde.api.profile.BehaviorProfile;
import io.horde.api.profile.WaitTime;
import io.horde.api.session.Session;
import io.horde.api.task.RequestSpec;
import io.horde.api.task.Task;
import io.horde.api.task.TaskDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import static io.horde.profiles.ChatPayloads.chat;
import static io.horde.profiles.ChatPayloads.pick;
import static io.horde.profiles.ChatPayloads.text;

/**
 * Behavior profiles for load testing the chat site and its AI tool endpoints.
 * <p>
 * Usage:
 * <pre>{@code
 * orchestrator.start(List.of(
 *         ProfileLoad.of(ChatProfiles.chatUser(), 1000, 50),
 *         ProfileLoad.of(ChatProfiles.burstUser(), 50, 10)),
 *     TargetDescriptor.of("https://your-domain.com"));
 * }</pre>
 */
public final class ChatProfiles {

    public static final String SESSION_ID = "session_id";
    public static final String MESSAGES = "messages";

    static final Duration HEAVY_TIMEOUT = Duration.ofSeconds(60);

    private ChatProfiles() {}

    /**
     * Regular chat user: simple prompts, multi-turn conversations, tool endpoints,
     * health checks and the homepage.
     */
    public static BehaviorProfile chatUser() {
        return BehaviorProfile.named("chat-user")
                .waitTime(WaitTime.between(Duration.ofSeconds(1), Duration.ofSeconds(5)))
                .onStart(ChatProfiles::startSession)
                .task("chat_simple", 10, session ->
                        RequestSpec.post("/api/chat", chat(pick(ChatPayloads.SAMPLE_PROMPTS), ChatPayloads.DEFAULT_MODEL))
                                .named("/api/chat [simple]"))
                .task("chat_conversation", 5, session ->
                        RequestSpec.post("/api/chat", chat(ChatPayloads.withFollowUp(transcript(session)), ChatPayloads.DEFAULT_MODEL))
                                .named("/api/chat [conversation]"))
                .task("tool_endpoint", 3, session -> {
                    String endpoint = pick(ChatPayloads.TOOL_ENDPOINTS);
                    return RequestSpec.post(endpoint, ChatPayloads.toolRequest()).named(endpoint + " [tool]");
                })
                .task("check_health", 1, session -> RequestSpec.get("/api/health").named("/api/health"))
                .task("view_homepage", 1, session -> RequestSpec.get("/").named("Homepage"))
                .build();
    }

    /**
     * Document-processing user sending very large prompts to the stronger model.
     */
    public static BehaviorProfile heavyUser() {
        return BehaviorProfile.named("heavy-user")
                .waitTime(WaitTime.between(Duration.ofSeconds(2), Duration.ofSeconds(8)))
                .task(TaskDefinition.builder("chat_heavy", session ->
                                RequestSpec.post("/api/chat", chat(ChatPayloads.largePrompt(), ChatPayloads.HEAVY_MODEL))
                                        .named("/api/chat [heavy]"))
                        .timeout(HEAVY_TIMEOUT)
                        .build())
                .build();
    }

    /**
     * Burst traffic probing the rate limiter. Being throttled is the expected result here,
     * so 429 counts as success for this profile only.
     */
    public static BehaviorProfile burstUser() {
        ClassificationPolicy throttlingExpected = ClassificationPolicy.defaults()
                .with(ClassificationPolicy.TOO_MANY_REQUESTS, Verdict.SUCCESS, "throttled as expected");
        return BehaviorProfile.named("burst-user")
                .waitTime(WaitTime.between(Duration.ofMillis(100), Duration.ofSeconds(1)))
                .task(TaskDefinition.builder("rapid_requests", session ->
                                RequestSpec.post("/api/chat", chat("Quick test", null))
                                        .named("/api/chat [burst]"))
                        .policy(throttlingExpected)
                        .build())
                .build();
    }

    /**
     * One task per API feature, tagged so a run can target a subset
     * (e.g. {@code RunConfig.create().tags("monitoring")}).
     */
    public static BehaviorProfile taggedEndpointUser() {
        return BehaviorProfile.named("endpoint-user")
                .waitTime(WaitTime.between(Duration.ofSeconds(1), Duration.ofSeconds(5)))
                .task(tagged("chat_endpoint", 5, "chat", session ->
                        json(RequestSpec.post("/api/chat", chat(pick(ChatPayloads.LOCAL_PROMPTS), pick(ChatPayloads.MODELS))))))
                .task(tagged("translate_endpoint", 2, "translate", session -> {
                    Map<String, Object> body = text(pick(ChatPayloads.LOCAL_PROMPTS));
                    body.put("targetLanguage", pick(ChatPayloads.TARGET_LANGUAGES));
                    return json(RequestSpec.post("/api/translate", body));
                }))
                .task(tagged("grammar_check_endpoint", 2, "grammar", session ->
                        json(RequestSpec.post("/api/grammar-check", text("I goes to the store yesterday and buys some apples")))))
                .task(tagged("summarize_endpoint", 2, "summarize", session ->
                        json(RequestSpec.post("/api/summarize", text(
                                "Artificial intelligence (AI) is intelligence demonstrated by machines, "
                                        + "as opposed to natural intelligence displayed by animals including humans. "
                                        + "AI research has been defined as the field of study of intelligent agents...")))))
                .task(tagged("paraphrase_endpoint", 1, "paraphrase", session ->
                        json(RequestSpec.post("/api/paraphrase", text("The quick brown fox jumps over the lazy dog")))))
                .task(tagged("health_check", 1, "monitoring", session -> RequestSpec.get("/api/monitoring/health")))
                .task(tagged("metrics_check", 1, "monitoring", session -> RequestSpec.get("/api/monitoring/metrics?format=json")))
                .build();
    }

    /**
     * Rapid-fire chat requests on the fast model.
     */
    public static BehaviorProfile stressUser() {
        return BehaviorProfile.named("stress-user")
                .waitTime(WaitTime.between(Duration.ofMillis(100), Duration.ofMillis(500)))
                .task("stress_test_chat", 1, session ->
                        RequestSpec.post("/api/chat", chat("Quick test", ChatPayloads.FAST_MODEL)))
                .build();
    }

    public static BehaviorProfile premiumUser() {
        return BehaviorProfile.named("premium-user")
                .waitTime(WaitTime.between(Duration.ofSeconds(2), Duration.ofSeconds(8)))
                .task("premium_request", 1, session ->
                        RequestSpec.post("/api/chat", chat("Write a comprehensive business plan for a tech startup",
                                ChatPayloads.DEFAULT_MODEL)))
                .build();
    }

    static void startSession(Session session) {
        session.put(SESSION_ID, "session_" + ThreadLocalRandom.current().nextInt(1000, 10000));
        session.put(MESSAGES, new Conversation());
    }

    static List<Map<String, String>> transcript(Session session) {
        return session.get(MESSAGES, Conversation.class)
                .orElseGet(() -> {
                    Conversation created = new Conversation();
                    session.put(MESSAGES, created);
                    return created;
                })
                .messages();
    }

    private static TaskDefinition tagged(String name, int weight, String tag, Task task) {
        return TaskDefinition.builder(name, task).weight(weight).tags(tag).build();
    }

    private static RequestSpec json(RequestSpec spec) {
        return spec.header("Content-Type", "application/json");
    }
}
