package fun.ai.bothost.bot.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.log.BotEventChannel;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.log.BotLogEntry;
import fun.ai.bothost.bot.log.BotStatusEvent;
import fun.ai.bothost.common.BotNotFoundException;
import fun.ai.bothost.enums.FunAiBotStatus;
import fun.ai.bothost.service.FunAiBotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BotLogWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FunAiBotService botService;
    private BotLogAggregator logAggregator;
    private BotLogWebSocketHandler handler;
    private WebSocketSession session;
    private final List<JsonNode> sent = new ArrayList<>();
    private final AtomicReference<Consumer<BotLogEntry>> logSink = new AtomicReference<>();
    private final AtomicReference<Consumer<BotStatusEvent>> statusSink = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        botService = mock(FunAiBotService.class);
        logAggregator = new BotLogAggregator(new BotHostProperties(), Runnable::run);
        handler = new BotLogWebSocketHandler(botService, logAggregator, objectMapper);

        session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
        when(session.getId()).thenReturn("s1");
        doAnswer(inv -> {
            WebSocketMessage<?> m = inv.getArgument(0);
            sent.add(objectMapper.readTree(((TextMessage) m).getPayload()));
            return null;
        }).when(session).sendMessage(any());

        when(botService.subscribeLogs(anyString(), any())).thenAnswer(inv -> {
            logSink.set(inv.getArgument(1));
            return (BotEventChannel.Subscription) () -> logSink.set(null);
        });
        when(botService.subscribeStatus(anyString(), any())).thenAnswer(inv -> {
            statusSink.set(inv.getArgument(1));
            return (BotEventChannel.Subscription) () -> statusSink.set(null);
        });
    }

    private List<String> types() {
        return sent.stream().map(n -> n.get("type").asText()).toList();
    }

    @Test
    void backfillsHistoryThenStreamsWithoutDuplicates() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=b1"));
        logAggregator.appendDeployment("b1", "Starting archive deployment");
        BotLogEntry second = logAggregator.appendRuntime("b1", "hello");

        handler.afterConnectionEstablished(session);

        assertEquals(List.of("ready", "log", "log"), types());
        assertEquals("Starting archive deployment", sent.get(1).get("data").get("text").asText());
        assertEquals("RUNTIME", sent.get(2).get("data").get("phase").asText());

        // 回放期间已经发送过的条目再次到达时丢弃
        logSink.get().accept(second);
        BotLogEntry third = logAggregator.appendRuntime("b1", "world");
        logSink.get().accept(third);

        assertEquals(4, sent.size());
        assertEquals(third.getSeq(), sent.get(3).get("data").get("seq").asLong());
    }

    @Test
    void runtimeHistoryOlderThanRedeployIsStillSent() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=b1"));
        logAggregator.appendRuntime("b1", "previous run output");
        logAggregator.beginDeployment("b1");
        logAggregator.appendDeployment("b1", "Starting repository deployment");

        handler.afterConnectionEstablished(session);

        assertEquals(List.of("ready", "log", "log"), types());
        assertEquals("Starting repository deployment", sent.get(1).get("data").get("text").asText());
        assertEquals("previous run output", sent.get(2).get("data").get("text").asText());
    }

    @Test
    void forwardsStatusChanges() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=b1"));
        handler.afterConnectionEstablished(session);

        statusSink.get().accept(new BotStatusEvent("b1", FunAiBotStatus.STOPPED, FunAiBotStatus.RUNNING, Instant.now()));

        JsonNode last = sent.get(sent.size() - 1);
        assertEquals("status", last.get("type").asText());
        assertEquals("STOPPED", last.get("data").get("from").asText());
        assertEquals("RUNNING", last.get("data").get("to").asText());
    }

    @Test
    void pingIsAnswered() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=b1"));
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleMessage(session, new TextMessage("not json"));

        assertEquals("pong", types().get(types().size() - 1));
        assertEquals(1, types().stream().filter("pong"::equals).count());
    }

    @Test
    void closeUnsubscribes() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=b1"));
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertNull(logSink.get());
        assertNull(statusSink.get());
    }

    @Test
    void missingBotIdIsRejected() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs"));

        handler.afterConnectionEstablished(session);

        assertEquals(List.of("error"), types());
        verify(session).close(CloseStatus.BAD_DATA);
        verifyNoInteractions(botService);
    }

    @Test
    void unknownBotIsRejected() throws Exception {
        when(session.getUri()).thenReturn(URI.create("ws://localhost/api/fun-ai/bot/ws/logs?botId=ghost"));
        when(botService.subscribeLogs(eq("ghost"), any())).thenThrow(BotNotFoundException.bot("ghost"));

        handler.afterConnectionEstablished(session);

        assertEquals(List.of("error"), types());
        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(status.capture());
        assertEquals(CloseStatus.POLICY_VIOLATION, status.getValue());
    }
}
