package fun.ai.bothost.common;

public class SpawnFailedException extends BotHostException {
    public SpawnFailedException(String botName, Throwable cause) {
        super(BotErrorCode.SPAWN_FAILED, "bot 进程启动失败: " + botName + ", " + cause.getMessage(), cause);
    }
}
