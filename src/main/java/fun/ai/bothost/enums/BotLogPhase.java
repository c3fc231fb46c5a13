package fun.ai.bothost.enums;

public enum BotLogPhase {
    DEPLOYMENT,
    RUNTIME
}
