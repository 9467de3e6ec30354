package com.autoagent.provider.impl;

import com.autoagent.agent.InboundRecord;
import com.autoagent.agent.SubscriptionSource;
import com.autoagent.dto.echochambers.RoomInfo;
import com.autoagent.dto.echochambers.RoomMessage;
import com.autoagent.exception.ConfigurationException;
import com.autoagent.exception.ProviderException;
import com.autoagent.provider.InMemoryCredentialStore;
import com.autoagent.provider.ProviderContext;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.QueueDispatcher;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class EchochambersProviderTest {

    private static final String HISTORY_JSON = "{\"messages\":["
            + "{\"id\":\"m3\",\"content\":\"Any thoughts, @Bot?\",\"sender\":{\"username\":\"bob\",\"model\":\"gpt\"},\"timestamp\":\"2024-01-01T10:03:00Z\",\"roomId\":\"general\"},"
            + "{\"id\":\"m2\",\"content\":\"My own words @bot\",\"sender\":{\"username\":\"bot\",\"model\":\"test-model\"},\"timestamp\":\"2024-01-01T10:02:00Z\",\"roomId\":\"general\"},"
            + "{\"id\":\"m1\",\"content\":\"Hello room\",\"sender\":{\"username\":\"alice\",\"model\":\"claude\"},\"timestamp\":\"2024-01-01T10:01:00Z\",\"roomId\":\"general\"}"
            + "]}";

    private MockWebServer mockRoomServer;

    @BeforeEach
    void setUp() throws IOException {
        mockRoomServer = new MockWebServer();
        mockRoomServer.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockRoomServer.shutdown();
    }

    @Test
    void getRoomInfo_shouldFindRoomAndDefaultTopic() throws Exception {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of());
        enqueueJson("{\"rooms\":[{\"id\":\"other\",\"name\":\"Other\",\"topic\":\"Elsewhere\"},"
                + "{\"id\":\"general\",\"name\":\"General\",\"tags\":[\"ai\"],\"messageCount\":12}]}");

        // --- Act ---
        Object result = provider.performAction("get-room-info", Map.of());

        // --- Assert ---
        RoomInfo info = (RoomInfo) result;
        assertThat(info.getName()).isEqualTo("General");
        assertThat(info.getTopic()).isEqualTo("General Discussion");
        assertThat(info.getTags()).containsExactly("ai");
        assertThat(info.getMessageCount()).isEqualTo(12);
        RecordedRequest request = mockRoomServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/rooms");
        assertThat(request.getHeader("x-api-key")).isEqualTo("room-key");
    }

    @Test
    void getRoomInfo_shouldFailForMissingRoom() {
        EchochambersProvider provider = provider(Map.of());
        enqueueJson("{\"rooms\":[{\"id\":\"other\"}]}");

        assertThatThrownBy(() -> provider.performAction("get-room-info", Map.of()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("general");
    }

    @Test
    void getRoomHistory_shouldReturnAtMostHistoryReadCount() throws Exception {
        EchochambersProvider provider = provider(Map.of("history_read_count", 2));
        enqueueJson(HISTORY_JSON);

        @SuppressWarnings("unchecked")
        List<RoomMessage> history = (List<RoomMessage>) provider.performAction("get-room-history", Map.of());

        assertThat(history).extracting(RoomMessage::getId).containsExactly("m3", "m2");
        assertThat(mockRoomServer.takeRequest().getPath()).isEqualTo("/api/rooms/general/history");
    }

    @Test
    void sendMessage_shouldPostContentWithSenderAndTrackHistory() throws Exception {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("post_history_track", 2));
        for (int i = 0; i < 3; i++) {
            enqueueJson("{\"id\":\"sent-" + i + "\"}");
        }

        // --- Act ---
        provider.performAction("send-message", Map.of("content", "first"));
        provider.performAction("send-message", Map.of("content", "second"));
        Object response = provider.performAction("send-message", Map.of("content", "third"));

        // --- Assert ---
        assertThat(response).isEqualTo(Map.of("id", "sent-2"));
        RecordedRequest request = mockRoomServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/rooms/general/message");
        assertThat(request.getHeader("x-api-key")).isEqualTo("room-key");
        assertThat(request.getBody().readUtf8())
                .contains("\"content\":\"first\"")
                .contains("\"sender\":{\"username\":\"bot\",\"model\":\"test-model\"}");
        assertThat(provider.performAction("get-post-history", Map.of())).isEqualTo(List.of("second", "third"));
    }

    @Test
    void sendMessage_shouldNotTrackFailedPosts() {
        EchochambersProvider provider = provider(Map.of());
        mockRoomServer.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"bad\"}"));

        assertThatThrownBy(() -> provider.performAction("send-message", Map.of("content", "lost")))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("Failed to send message");
        assertThat(provider.performAction("get-post-history", Map.of())).isEqualTo(List.of());
    }

    @Test
    void processRoomHistory_shouldQueueUnseenMessagesFromOthersOldestFirst() {
        EchochambersProvider provider = provider(Map.of());
        enqueueJson(HISTORY_JSON);
        enqueueJson(HISTORY_JSON);

        @SuppressWarnings("unchecked")
        List<RoomMessage> first = (List<RoomMessage>) provider.performAction("process-room-history", Map.of());
        @SuppressWarnings("unchecked")
        List<RoomMessage> second = (List<RoomMessage>) provider.performAction("process-room-history", Map.of());

        assertThat(first).extracting(RoomMessage::getId).containsExactly("m1", "m3");
        assertThat(second).isEmpty();
    }

    @Test
    void openSubscription_shouldDeliverMentionsFromOthersOnce() {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("mention_poll_seconds", 1));
        ((QueueDispatcher) mockRoomServer.getDispatcher()).setFailFast(true);
        enqueueJson(HISTORY_JSON);
        enqueueJson(HISTORY_JSON);
        List<InboundRecord> received = new CopyOnWriteArrayList<>();
        SubscriptionSource source = provider.openSubscription("@bot");
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // --- Act ---
        try {
            executor.submit(() -> {
                source.stream(received::add);
                return null;
            });
            await().atMost(Duration.ofSeconds(10)).until(() -> mockRoomServer.getRequestCount() >= 2);
        } finally {
            executor.shutdownNow();
        }

        // --- Assert ---
        assertThat(received).hasSize(1);
        InboundRecord mention = received.get(0);
        assertThat(mention.id()).isEqualTo("m3");
        assertThat(mention.author()).isEqualTo("bob");
        assertThat(mention.source()).isEqualTo("echochambers");
    }

    @Test
    void processRoomHistory_shouldReturnRemainderAfterFullBatch() {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("history_read_count", 150));
        String history = historyJson(150);
        for (int i = 0; i < 3; i++) {
            enqueueJson(history);
        }

        // --- Act ---
        @SuppressWarnings("unchecked")
        List<RoomMessage> first = (List<RoomMessage>) provider.performAction("process-room-history", Map.of());
        @SuppressWarnings("unchecked")
        List<RoomMessage> second = (List<RoomMessage>) provider.performAction("process-room-history", Map.of());
        @SuppressWarnings("unchecked")
        List<RoomMessage> third = (List<RoomMessage>) provider.performAction("process-room-history", Map.of());

        // --- Assert ---
        assertThat(first).hasSize(EchochambersProvider.MAX_BATCH_SIZE);
        assertThat(first.get(0).getId()).isEqualTo("m0");
        assertThat(second).hasSize(50);
        assertThat(second.get(0).getId()).isEqualTo("m100");
        assertThat(second.get(49).getId()).isEqualTo("m149");
        assertThat(third).isEmpty();
    }

    @Test
    void openSubscription_shouldKeepPollingAfterFailedRequest() {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("mention_poll_seconds", 1));
        ((QueueDispatcher) mockRoomServer.getDispatcher()).setFailFast(true);
        mockRoomServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        mockRoomServer.enqueue(new MockResponse().setResponseCode(503));
        enqueueJson(HISTORY_JSON);
        List<InboundRecord> received = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // --- Act ---
        try {
            executor.submit(() -> {
                provider.openSubscription("@bot").stream(received::add);
                return null;
            });
            await().atMost(Duration.ofSeconds(15)).until(() -> !received.isEmpty());
        } finally {
            executor.shutdownNow();
        }

        // --- Assert ---
        assertThat(received).extracting(InboundRecord::id).containsExactly("m3");
    }

    @Test
    void openSubscription_shouldSkipMessagesWithoutSender() {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("mention_poll_seconds", 1));
        ((QueueDispatcher) mockRoomServer.getDispatcher()).setFailFast(true);
        enqueueJson("{\"messages\":["
                + "{\"id\":\"m5\",\"content\":\"@bot are you there?\",\"sender\":{\"username\":\"carol\"}},"
                + "{\"id\":\"m4\",\"content\":\"anonymous @bot\"}"
                + "]}");
        List<InboundRecord> received = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // --- Act ---
        try {
            executor.submit(() -> {
                provider.openSubscription("@bot").stream(received::add);
                return null;
            });
            await().atMost(Duration.ofSeconds(10)).until(() -> mockRoomServer.getRequestCount() >= 2);
        } finally {
            executor.shutdownNow();
        }

        // --- Assert ---
        assertThat(received).extracting(InboundRecord::id).containsExactly("m5");
    }

    @Test
    void openSubscription_shouldNotRedeliverAfterRestart() throws Exception {
        // --- Arrange ---
        EchochambersProvider provider = provider(Map.of("mention_poll_seconds", 1));
        ((QueueDispatcher) mockRoomServer.getDispatcher()).setFailFast(true);
        enqueueJson(HISTORY_JSON);
        List<InboundRecord> received = new CopyOnWriteArrayList<>();

        // --- Act ---
        ExecutorService firstRun = Executors.newSingleThreadExecutor();
        try {
            firstRun.submit(() -> {
                provider.openSubscription("@bot").stream(received::add);
                return null;
            });
            await().atMost(Duration.ofSeconds(10)).until(() -> !received.isEmpty());
        } finally {
            firstRun.shutdownNow();
        }
        assertThat(firstRun.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        enqueueJson(HISTORY_JSON);
        int requestsBeforeRestart = mockRoomServer.getRequestCount();
        ExecutorService secondRun = Executors.newSingleThreadExecutor();
        try {
            secondRun.submit(() -> {
                provider.openSubscription("@bot").stream(received::add);
                return null;
            });
            await().atMost(Duration.ofSeconds(10)).until(() -> mockRoomServer.getRequestCount() > requestsBeforeRestart + 1);
        } finally {
            secondRun.shutdownNow();
        }

        // --- Assert ---
        assertThat(received).extracting(InboundRecord::id).containsExactly("m3");
    }

    @Test
    void validateConfig_shouldNormalizeWithoutApplying() {
        EchochambersProvider provider = new EchochambersProvider("echochambers", context());

        Map<String, Object> validated = provider.validateConfig(config(Map.of("api_url", "http://rooms.local/")));

        assertThat(validated)
                .containsEntry("api_url", "http://rooms.local")
                .containsEntry("message_interval", EchochambersProvider.DEFAULT_MESSAGE_INTERVAL_SECONDS)
                .containsEntry("mention_poll_seconds", EchochambersProvider.DEFAULT_MENTION_POLL_SECONDS);
        assertThat(provider.isConfigured()).isFalse();
    }

    @Test
    void initialize_shouldRejectInvalidConfiguration() {
        EchochambersProvider missingKey = new EchochambersProvider("echochambers", context());
        Map<String, Object> withoutKey = new HashMap<>(config(Map.of()));
        withoutKey.remove("api_key");

        assertThatThrownBy(() -> missingKey.initialize(withoutKey))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("api_key");

        EchochambersProvider zeroHistory = new EchochambersProvider("echochambers", context());
        assertThatThrownBy(() -> zeroHistory.initialize(config(Map.of("history_read_count", 0))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("history_read_count");
    }

    @Test
    void isConfigured_shouldNotCallServer() {
        EchochambersProvider provider = provider(Map.of("message_interval", 120));

        assertThat(provider.isConfigured()).isTrue();
        assertThat(provider.getMessageIntervalSeconds()).isEqualTo(120);
        assertThat(mockRoomServer.getRequestCount()).isZero();
    }

    private EchochambersProvider provider(Map<String, Object> overrides) {
        EchochambersProvider provider = new EchochambersProvider("echochambers", context());
        provider.initialize(config(overrides));
        return provider;
    }

    private Map<String, Object> config(Map<String, Object> overrides) {
        Map<String, Object> config = new HashMap<>();
        config.put("name", "echochambers");
        config.put("api_url", mockRoomServer.url("/").toString());
        config.put("api_key", "room-key");
        config.put("room", "general");
        config.put("history_read_count", 10);
        config.put("sender_username", "bot");
        config.put("sender_model", "test-model");
        config.putAll(overrides);
        return config;
    }

    private ProviderContext context() {
        return new ProviderContext(new InMemoryCredentialStore(), WebClient.create(), question -> "n", null);
    }

    private static String historyJson(int count) {
        StringBuilder json = new StringBuilder("{\"messages\":[");
        for (int i = count - 1; i >= 0; i--) {
            json.append("{\"id\":\"m").append(i).append("\",\"content\":\"message ").append(i)
                    .append("\",\"sender\":{\"username\":\"alice\",\"model\":\"claude\"}}");
            if (i > 0) {
                json.append(',');
            }
        }
        return json.append("]}").toString();
    }

    private void enqueueJson(String body) {
        mockRoomServer.enqueue(new MockResponse().setBody(body).addHeader("Content-Type", "application/json"));
    }
}
