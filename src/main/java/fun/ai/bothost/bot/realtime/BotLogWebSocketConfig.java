package fun.ai.bothost.bot.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.service.FunAiBotService;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class BotLogWebSocketConfig implements WebSocketConfigurer {
    private final FunAiBotService botService;
    private final BotLogAggregator logAggregator;
    private final ObjectMapper objectMapper;

    public BotLogWebSocketConfig(FunAiBotService botService, BotLogAggregator logAggregator, ObjectMapper objectMapper) {
        this.botService = botService;
        this.logAggregator = logAggregator;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(new BotLogWebSocketHandler(botService, logAggregator, objectMapper), "/api/fun-ai/bot/ws/logs")
                .setAllowedOriginPatterns("*");
    }
}
