package fun.ai.bothost.bot.process;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * botId -> 存活进程句柄；保证每个 bot 至多一个句柄。
 */
@Component
public class BotProcessRegistry {
    private final ConcurrentHashMap<String, BotProcessHandle> handles = new ConcurrentHashMap<>();

    /**
     * @return 已存在句柄时返回 false（不覆盖）
     */
    public boolean register(BotProcessHandle handle) {
        return handles.putIfAbsent(handle.getBotId(), handle) == null;
    }

    public BotProcessHandle get(String botId) {
        return botId == null ? null : handles.get(botId);
    }

    public boolean contains(String botId) {
        return botId != null && handles.containsKey(botId);
    }

    /**
     * 条件释放：只有持有该句柄本身的一方才能移除，避免旧进程的退出回调误删新进程句柄
     */
    public boolean release(String botId, BotProcessHandle handle) {
        return handles.remove(botId, handle);
    }

    public List<BotProcessHandle> snapshot() {
        return List.copyOf(handles.values());
    }

    public int size() {
        return handles.size();
    }
}
