package com.autoagent.provider.impl;

import com.autoagent.agent.InboundRecord;
import com.autoagent.agent.SubscriptionSource;
import com.autoagent.dto.echochambers.PostMessageRequest;
import com.autoagent.dto.echochambers.RoomHistoryResponse;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.dto.echochambers.RoomMessage;
import com.autoagent.dto.echochambers.RoomsResponse;
import com.autoagent.exception.ProviderException;
import com.autoagent.model.Operation;
import com.autoagent.model.OperationParameter;
import com.autoagent.model.ParameterType;
import com.autoagent.provider.AbstractCapabilityProvider;
import com.autoagent.provider.ProviderContext;
import com.autoagent.provider.SubscriptionProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Connects the agent to one room of an Echochambers server.
 * <p>
 * Every request carries the configured key in the {@code x-api-key} header. The provider keeps
 * the last {@code post_history_track} messages it sent so post generation can avoid repeating
 * itself, and the IDs of room messages it already handed out.
 */
@Slf4j
public class EchochambersProvider extends AbstractCapabilityProvider implements SubscriptionProvider {

    public static final String NAME = "echochambers";

    static final String DEFAULT_TOPIC = "General Discussion";
    static final int DEFAULT_POST_HISTORY_TRACK = 50;
    static final int DEFAULT_MESSAGE_INTERVAL_SECONDS = 60;
    static final int DEFAULT_MENTION_POLL_SECONDS = 30;
    static final int MAX_BATCH_SIZE = 100;
    static final int MAX_TRACKED_IDS = 1000;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final List<String> REQUIRED_FIELDS =
            List.of("api_url", "api_key", "room", "history_read_count", "sender_username", "sender_model");

    private String apiUrl;
    private String apiKey;
    private String room;
    private String senderUsername;
    private String senderModel;
    private int historyReadCount;
    private int postHistoryTrack;
    private Duration mentionPollInterval;

    private final Deque<String> sentMessages = new ArrayDeque<>();
    private final Set<String> processedMessages = boundedIdSet(MAX_TRACKED_IDS);
    // Survives a restart of the subscription, so delivered mentions are not delivered again.
    private final Set<String> deliveredMentions = boundedIdSet(MAX_TRACKED_IDS);

    public EchochambersProvider(String name, ProviderContext context) {
        super(name, context);
    }

    @Override
    public boolean isLlmProvider() {
        return false;
    }

    @Override
    public Map<String, Object> validateConfig(Map<String, Object> raw) {
        requireFields(getName(), raw, REQUIRED_FIELDS);
        Map<String, Object> validated = new LinkedHashMap<>(raw);
        String url = requireString(raw, "api_url");
        validated.put("api_url", url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        for (String field : List.of("api_key", "room", "sender_username", "sender_model")) {
            requireString(raw, field);
        }
        requirePositiveInt(raw, "history_read_count");
        validated.put("post_history_track", optionalPositiveInt(raw, "post_history_track", DEFAULT_POST_HISTORY_TRACK));
        validated.put("mention_poll_seconds", optionalPositiveInt(raw, "mention_poll_seconds", DEFAULT_MENTION_POLL_SECONDS));
        validated.put("message_interval", optionalPositiveInt(raw, "message_interval", DEFAULT_MESSAGE_INTERVAL_SECONDS));
        return validated;
    }

    @Override
    protected void applyConfig(Map<String, Object> config) {
        this.apiUrl = (String) config.get("api_url");
        this.apiKey = (String) config.get("api_key");
        this.room = (String) config.get("room");
        this.senderUsername = (String) config.get("sender_username");
        this.senderModel = (String) config.get("sender_model");
        this.historyReadCount = (Integer) config.get("history_read_count");
        this.postHistoryTrack = (Integer) config.get("post_history_track");
        this.mentionPollInterval = Duration.ofSeconds((Integer) config.get("mention_poll_seconds"));
        log.info("Echochambers connection to {} in room {}", apiUrl, room);
    }

    @Override
    protected void registerActions() {
        register(Operation.of("get-room-info", "Get information about the current room including topic and tags",
                params -> getRoomInfo()));
        register(Operation.of("get-room-history", "Get message history from the Echochambers room",
                params -> getRoomHistory()));
        register(Operation.of("send-message", "Send a message to the Echochambers room",
                params -> sendMessage((String) params.get("content")),
                OperationParameter.required("content", ParameterType.STRING, "The message content to send")));
        register(Operation.of("process-room-history", "Return new messages from other senders, oldest first",
                params -> processRoomHistory()));
        register(Operation.of("get-post-history", "List the messages this agent recently sent, oldest first",
                params -> getPostHistory()));
    }

    /**
     * Checks the connection by looking the room up on the server.
     */
    @Override
    public boolean configure() {
        log.info("Configuring Echochambers connection");
        try {
            getRoomInfo();
            log.info("Successfully configured Echochambers connection");
            return true;
        } catch (Exception e) {
            log.error("Failed to configure Echochambers connection: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Reports whether all connection settings are present. Reachability is checked by
     * {@link #configure()}, not here, so that every dispatch does not cost a request.
     */
    @Override
    public boolean isConfigured(boolean verbose) {
        boolean configured = apiUrl != null && apiKey != null && room != null && senderUsername != null && senderModel != null;
        if (!configured && verbose) {
            log.info("Echochambers connection is not configured");
        }
        return configured;
    }

    /**
     * @return the seconds to wait between two posts of the agent.
     */
    public int getMessageIntervalSeconds() {
        return (Integer) getConfig().get("message_interval");
    }

    public String getSenderUsername() {
        return senderUsername;
    }

    RoomInfo getRoomInfo() {
        RoomsResponse response = get(apiUrl + "/api/rooms", RoomsResponse.class, "Failed to get room info");
        RoomInfo info = response == null ? null : response.getRooms().stream()
                .filter(candidate -> room.equals(candidate.getId()))
                .findFirst()
                .orElse(null);
        if (info == null) {
            throw new ProviderException("Room '" + room + "' not found");
        }
        if (info.getTopic() == null) {
            info.setTopic(DEFAULT_TOPIC);
        }
        return info;
    }

    List<RoomMessage> getRoomHistory() {
        RoomHistoryResponse response = get(apiUrl + "/api/rooms/" + room + "/history", RoomHistoryResponse.class, "Failed to get room history");
        if (response == null || response.getMessages() == null) {
            return List.of();
        }
        List<RoomMessage> messages = response.getMessages();
        return List.copyOf(messages.subList(0, Math.min(historyReadCount, messages.size())));
    }

    Map<String, Object> sendMessage(String content) {
        PostMessageRequest request = new PostMessageRequest(content, new RoomMessage.Sender(senderUsername, senderModel));
        try {
            Map<String, Object> response = context.webClient().post()
                    .uri(apiUrl + "/api/rooms/" + room + "/message")
                    .headers(this::authorize)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                    .block(REQUEST_TIMEOUT);
            rememberSent(content);
            return response == null ? Map.of() : response;
        } catch (WebClientResponseException e) {
            throw new ProviderException("Failed to send message: " + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            throw new ProviderException("Failed to send message: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the messages from other senders not returned by an earlier call, oldest first, at
     * most {@value #MAX_BATCH_SIZE} per call. The rest are returned by the next calls.
     * <p>
     * The IDs of the last {@value #MAX_TRACKED_IDS} returned messages are remembered.
     */
    synchronized List<RoomMessage> processRoomHistory() {
        List<RoomMessage> history = new ArrayList<>(getRoomHistory());
        Collections.reverse(history);
        List<RoomMessage> batch = new ArrayList<>();
        for (RoomMessage message : history) {
            if (batch.size() >= MAX_BATCH_SIZE) {
                break;
            }
            if (message.getId() != null && !isOwn(message) && processedMessages.add(message.getId())) {
                batch.add(message);
            }
        }
        log.info("Found {} new messages to process", batch.size());
        return batch;
    }

    synchronized List<String> getPostHistory() {
        return List.copyOf(sentMessages);
    }

    /**
     * Polls the room history and delivers each new message from another sender whose content
     * contains {@code filter}, ignoring case.
     */
    @Override
    public SubscriptionSource openSubscription(String filter) {
        String needle = filter.toLowerCase(Locale.ROOT);
        return sink -> pollMentions(needle, sink);
    }

    private void pollMentions(String needle, Consumer<InboundRecord> sink) throws InterruptedException {
        log.info("Listening for '{}' in room {} every {}s", needle, room, mentionPollInterval.toSeconds());
        while (!Thread.currentThread().isInterrupted()) {
            try {
                for (RoomMessage message : getRoomHistory()) {
                    if (isMention(message, needle) && markDelivered(message.getId())) {
                        sink.accept(new InboundRecord(getName(), message.getId(), message.getSender().getUsername(), message.getContent(), Instant.now()));
                    }
                }
            } catch (RuntimeException e) {
                if (e.getCause() instanceof InterruptedException interrupted) {
                    throw interrupted;
                }
                log.warn("Polling room {} failed: {}", room, e.getMessage());
            }
            Thread.sleep(mentionPollInterval.toMillis());
        }
    }

    private boolean isMention(RoomMessage message, String needle) {
        if (message.getId() == null || message.getContent() == null
                || message.getSender() == null || message.getSender().getUsername() == null) {
            return false;
        }
        return !isOwn(message) && message.getContent().toLowerCase(Locale.ROOT).contains(needle);
    }

    private synchronized boolean markDelivered(String id) {
        return deliveredMentions.add(id);
    }

    private synchronized void rememberSent(String content) {
        sentMessages.addLast(content);
        while (sentMessages.size() > postHistoryTrack) {
            sentMessages.removeFirst();
        }
    }

    private boolean isOwn(RoomMessage message) {
        return message.getSender() != null && senderUsername.equals(message.getSender().getUsername());
    }

    // Insertion-ordered, forgets the oldest ID once full.
    private static Set<String> boundedIdSet(int capacity) {
        return Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    private <T> T get(String url, Class<T> type, String failure) {
        try {
            return context.webClient().get()
                    .uri(url)
                    .headers(this::authorize)
                    .retrieve()
                    .bodyToMono(type)
                    .block(REQUEST_TIMEOUT);
        } catch (WebClientResponseException e) {
            throw new ProviderException(failure + ": " + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            throw new ProviderException(failure + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ProviderException(failure + ": no response within " + REQUEST_TIMEOUT.toSeconds() + "s", e);
        }
    }

    private void authorize(HttpHeaders headers) {
        headers.set("x-api-key", apiKey);
    }
}
