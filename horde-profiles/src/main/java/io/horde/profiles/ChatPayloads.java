package io.horde.profiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Prompts, endpoints and request bodies shared by the bundled chat profiles.
 */
public final class ChatPayloads {

    public static final String DEFAULT_MODEL = "claude-3-7-sonnet-20250219";
    public static final String HEAVY_MODEL = "claude-sonnet-4-20250514";
    public static final String FAST_MODEL = "claude-3-haiku-20240307";

    public static final List<String> SAMPLE_PROMPTS = List.of(
            "Write a product description for a new smartphone",
            "Create a marketing email for a summer sale",
            "Explain the benefits of cloud computing",
            "Write a blog post about SEO best practices",
            "Translate this text to Spanish: Hello, how are you?",
            "Summarize the importance of content marketing",
            "Generate social media captions for a coffee shop",
            "Write code to reverse a string in Python",
            "Create a business plan outline for a startup",
            "Explain machine learning in simple terms"
    );

    public static final List<String> LOCAL_PROMPTS = List.of(
            "What is the capital of the Philippines?",
            "Explain machine learning in simple terms",
            "Write a short story about Manila",
            "Translate 'Hello, how are you?' to Tagalog",
            "Summarize the benefits of AI",
            "Write a business plan for a coffee shop",
            "Check grammar: 'I goes to the store yesterday'",
            "Paraphrase: 'The quick brown fox jumps over the lazy dog'",
            "Generate a slogan for a tech startup",
            "Write an essay about climate change"
    );

    public static final List<String> MODELS = List.of(
            "claude-3-5-sonnet-20241022",
            DEFAULT_MODEL,
            FAST_MODEL
    );

    public static final List<String> TARGET_LANGUAGES = List.of("Tagalog", "Cebuano", "Ilocano");

    public static final List<String> TOOL_ENDPOINTS = List.of(
            "/api/tools/grammar-check",
            "/api/tools/translator",
            "/api/tools/summarizer",
            "/api/tools/paraphraser",
            "/api/tools/content-generator",
            "/api/tools/seo-analyzer",
            "/api/tools/code-generator",
            "/api/tools/email-writer"
    );

    public static final String FOLLOW_UP = "Can you explain that in more detail?";
    public static final String CANNED_REPLY = "This is a test response.";

    private ChatPayloads() {}

    public static Map<String, Object> chat(List<Map<String, String>> messages, String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messages", messages);
        if (model != null) {
            body.put("model", model);
        }
        return body;
    }

    public static Map<String, Object> chat(String prompt, String model) {
        return chat(List.of(message("user", prompt)), model);
    }

    public static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    public static Map<String, Object> text(String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        return body;
    }

    public static Map<String, Object> toolRequest() {
        Map<String, Object> body = text("This is a sample text for testing the AI tool functionality.");
        body.put("options", Collections.emptyMap());
        return body;
    }

    /**
     * Document-sized prompt: all sample prompts repeated twenty times.
     */
    public static String largePrompt() {
        String joined = String.join(" ", SAMPLE_PROMPTS);
        return "Please analyze the following text: " + joined.repeat(20);
    }

    /**
     * Conversation history plus a follow-up question. The first call seeds the
     * transcript with one user prompt and a canned assistant reply.
     */
    public static List<Map<String, String>> withFollowUp(List<Map<String, String>> transcript) {
        if (transcript.size() < 2) {
            transcript.add(message("user", pick(SAMPLE_PROMPTS)));
            transcript.add(message("assistant", CANNED_REPLY));
        }
        List<Map<String, String>> messages = new ArrayList<>(transcript);
        messages.add(message("user", FOLLOW_UP));
        return messages;
    }

    public static <T> T pick(List<T> values) {
        return values.get(ThreadLocalRandom.current().nextInt(values.size()));
    }
}
