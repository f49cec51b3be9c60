package com.autonomous.pipeline.service;

import com.autonomous.pipeline.model.TokenUsage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Incremental parser for the agent's newline-delimited JSON event stream.
 *
 * <p>Chunks may end anywhere, so the unfinished tail of each chunk is carried over
 * until its newline arrives. Lines that are not JSON objects are passed through as
 * plain content.
 */
@Slf4j
public class AgentStreamParser {

    static final String ASK_HUMAN_TOOL = "askHuman";
    static final Pattern RATE_LIMIT_PATTERN = Pattern.compile("usage limit reached\\|(\\d+)");

    /**
     * Receives parsed events. Called on the thread that feeds the parser.
     */
    public interface Listener {
        void onRawLine(String line);

        void onContent(String text);

        void onReasoning(String type, String subtype, String content);

        void onHumanInputRequested(String question);
    }

    private final ObjectMapper mapper;
    private final Listener listener;
    private final StringBuilder carry = new StringBuilder();
    private final StringBuilder output = new StringBuilder();
    private final Map<String, TokenUsage> usageByMessage = new LinkedHashMap<>();
    private final TokenUsage anonymousUsage = new TokenUsage();

    private String model;
    private String question;
    private Instant rateLimitReset;

    public AgentStreamParser(ObjectMapper mapper, Listener listener) {
        this.mapper = mapper;
        this.listener = listener;
    }

    public void accept(CharSequence chunk) {
        carry.append(chunk);
        int newline;
        while ((newline = carry.indexOf("\n")) >= 0) {
            String line = carry.substring(0, newline);
            carry.delete(0, newline + 1);
            handleLine(line);
        }
    }

    /**
     * Flushes a final line that was not newline-terminated.
     */
    public void finish() {
        if (carry.length() > 0) {
            String line = carry.toString();
            carry.setLength(0);
            handleLine(line);
        }
    }

    public String getOutput() {
        return output.toString();
    }

    public String getModel() {
        return model;
    }

    public String getQuestion() {
        return question;
    }

    public Instant getRateLimitReset() {
        return rateLimitReset;
    }

    public TokenUsage getTokenUsage() {
        TokenUsage total = new TokenUsage();
        usageByMessage.values().forEach(total::add);
        total.add(anonymousUsage);
        return total;
    }

    private void handleLine(String rawLine) {
        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (line.isBlank()) {
            return;
        }
        listener.onRawLine(line);

        JsonNode event;
        try {
            event = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            event = null;
        }
        if (event == null || !event.isObject()) {
            appendContent(line + "\n");
            return;
        }
        handleEvent(event);
    }

    private void handleEvent(JsonNode event) {
        String type = event.path("type").asText("data");
        String subtype = event.path("subtype").asText("");

        switch (type) {
            case "assistant", "user" -> handleMessage(type, event.path("message"));
            case "result" -> {
                String result = event.path("result").asText("");
                listener.onReasoning(type, subtype.isEmpty() ? "result" : subtype, result);
                if (!result.isEmpty()) {
                    detectRateLimit(result);
                    appendContent(result);
                }
            }
            case "human_input_request" -> requestHuman(event.path("question").asText(""));
            default -> listener.onReasoning(type, subtype.isEmpty() ? "data" : subtype, event.toString());
        }
    }

    private void handleMessage(String type, JsonNode message) {
        if (message.hasNonNull("model")) {
            model = message.get("model").asText();
        }
        for (JsonNode item : message.path("content")) {
            String itemType = item.path("type").asText("data");
            switch (itemType) {
                case "thinking" -> listener.onReasoning(type, itemType, item.path("thinking").asText(""));
                case "text" -> {
                    String text = item.path("text").asText("");
                    listener.onReasoning(type, itemType, text);
                    detectRateLimit(text);
                    if ("assistant".equals(type)) {
                        appendContent(text + "\n");
                    }
                }
                case "tool_use" -> {
                    String toolName = item.path("name").asText("");
                    listener.onReasoning(type, itemType, toolName + "(" + item.path("input") + ")");
                    if (toolName.endsWith(ASK_HUMAN_TOOL)) {
                        requestHuman(item.path("input").path("question").asText(""));
                    }
                }
                default -> listener.onReasoning(type, itemType, item.path("content").asText(item.toString()));
            }
        }
        if ("assistant".equals(type) && message.has("usage")) {
            recordUsage(message.path("id").asText(""), message.path("usage"));
        }
    }

    // One message can arrive as several events repeating the same usage block
    private void recordUsage(String messageId, JsonNode usage) {
        TokenUsage tokens = TokenUsage.builder()
            .inputTokens(usage.path("input_tokens").asLong(0))
            .outputTokens(usage.path("output_tokens").asLong(0))
            .cacheCreationInputTokens(usage.path("cache_creation_input_tokens").asLong(0))
            .cacheReadInputTokens(usage.path("cache_read_input_tokens").asLong(0))
            .build();
        if (messageId.isEmpty()) {
            anonymousUsage.add(tokens);
        } else {
            usageByMessage.put(messageId, tokens);
        }
    }

    private void requestHuman(String text) {
        if (question != null || text.isBlank()) {
            return;
        }
        question = text;
        listener.onHumanInputRequested(text);
    }

    private void detectRateLimit(String text) {
        Matcher matcher = RATE_LIMIT_PATTERN.matcher(text);
        if (!matcher.find()) {
            return;
        }
        try {
            rateLimitReset = Instant.ofEpochSecond(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException | DateTimeException e) {
            log.warn("Ignoring usage limit signal with an unusable reset time: {}", matcher.group(1));
        }
    }

    private void appendContent(String text) {
        output.append(text);
        listener.onContent(text);
    }
}
