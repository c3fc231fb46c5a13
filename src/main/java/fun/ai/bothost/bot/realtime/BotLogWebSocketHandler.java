package fun.ai.bothost.bot.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.bot.log.BotEventChannel;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.log.BotLogEntry;
import fun.ai.bothost.bot.log.BotStatusEvent;
import fun.ai.bothost.common.BotHostException;
import fun.ai.bothost.service.FunAiBotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * bot 实时日志：
 * - 连接：ws://host/api/fun-ai/bot/ws/logs?botId=..
 * - 出站消息(JSON)：{type:"ready"} / {type:"log", data:{seq,timestamp,phase,text}} /
 *   {type:"status", data:{from,to,timestamp}} / {type:"error", data:"..."}
 * - 入站：{type:"ping"} -> {type:"pong"}，其它忽略
 *
 * 先订阅再回放：回放期间到达的实时日志先暂存，回放结束后丢弃 seq 不大于回放最大 seq 的条目再补发，保证不丢不重。
 */
public class BotLogWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(BotLogWebSocketHandler.class);

    private static final String STATE_KEY = "BOT_LOG_STATE";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final FunAiBotService botService;
    private final BotLogAggregator logAggregator;
    private final ObjectMapper objectMapper;

    public BotLogWebSocketHandler(FunAiBotService botService, BotLogAggregator logAggregator, ObjectMapper objectMapper) {
        this.botService = botService;
        this.logAggregator = logAggregator;
        this.objectMapper = objectMapper;
    }

    private static final class LogSessionState {
        WebSocketSession out;
        String botId;
        BotEventChannel.Subscription logSubscription;
        BotEventChannel.Subscription statusSubscription;
        boolean backfilled;
        long lastSeq;
        final List<BotLogEntry> pending = new ArrayList<>();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        String botId = parseQuery(session.getUri()).get("botId");
        if (botId == null || botId.isBlank()) {
            send(out, msg("error", "missing botId"));
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        LogSessionState st = new LogSessionState();
        st.out = out;
        st.botId = botId;
        session.getAttributes().put(STATE_KEY, st);

        try {
            st.logSubscription = botService.subscribeLogs(botId, entry -> onLog(st, entry));
            st.statusSubscription = botService.subscribeStatus(botId, event -> onStatus(st, event));
        } catch (BotHostException e) {
            send(out, msg("error", e.getMessage()));
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        send(out, msg("ready", botId));
        List<BotLogEntry> history = logAggregator.getAll(botId);
        synchronized (st) {
            // 回放顺序是部署日志在前、运行日志在后，seq 不单调，整段发送后再取最大值
            for (BotLogEntry entry : history) {
                writeLog(st, entry);
                st.lastSeq = Math.max(st.lastSeq, entry.getSeq());
            }
            for (BotLogEntry entry : st.pending) {
                sendLog(st, entry);
            }
            st.pending.clear();
            st.backfilled = true;
        }
        log.debug("bot log ws connected: botId={}, session={}, backfill={}", botId, session.getId(), history.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        LogSessionState st = (LogSessionState) session.getAttributes().get(STATE_KEY);
        if (st == null) return;
        Map<?, ?> m;
        try {
            m = objectMapper.readValue(message.getPayload(), Map.class);
        } catch (JsonProcessingException e) {
            log.debug("bot log ws ignored non-json message: botId={}", st.botId);
            return;
        }
        if ("ping".equals(String.valueOf(m.get("type")))) {
            send(st.out, msg("pong", null));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        LogSessionState st = (LogSessionState) session.getAttributes().remove(STATE_KEY);
        if (st == null) return;
        if (st.logSubscription != null) st.logSubscription.unsubscribe();
        if (st.statusSubscription != null) st.statusSubscription.unsubscribe();
        log.debug("bot log ws closed: botId={}, session={}, status={}", st.botId, session.getId(), status);
    }

    private void onLog(LogSessionState st, BotLogEntry entry) {
        synchronized (st) {
            if (!st.backfilled) {
                st.pending.add(entry);
                return;
            }
            sendLog(st, entry);
        }
    }

    private void onStatus(LogSessionState st, BotStatusEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", event.getFrom());
        data.put("to", event.getTo());
        data.put("timestamp", event.getTimestamp().toString());
        send(st.out, msg("status", data));
    }

    /**
     * 调用方持有 st 锁
     */
    private void sendLog(LogSessionState st, BotLogEntry entry) {
        if (entry.getSeq() <= st.lastSeq) {
            return;
        }
        st.lastSeq = entry.getSeq();
        writeLog(st, entry);
    }

    private void writeLog(LogSessionState st, BotLogEntry entry) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", entry.getSeq());
        data.put("timestamp", entry.getTimestamp().toString());
        data.put("phase", entry.getPhase());
        data.put("text", entry.getText());
        send(st.out, msg("log", data));
    }

    private void send(WebSocketSession session, String json) {
        if (session == null || !session.isOpen() || json == null) return;
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.debug("bot log ws send failed: session={}, error={}", session.getId(), e.getMessage());
        }
    }

    private String msg(String type, Object data) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put("data", data);
        try {
            return objectMapper.writeValueAsString(m);
        } catch (JsonProcessingException e) {
            log.warn("bot log ws serialize failed: type={}, error={}", type, e.getMessage());
            return null;
        }
    }

    private Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        if (uri == null) return out;
        var params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        for (String k : params.keySet()) {
            out.put(k, params.getFirst(k));
        }
        return out;
    }
}
