package fun.ai.bothost.enums;

public enum BotHealthStatus {
    HEALTHY,
    UNHEALTHY,
    UNKNOWN
}
