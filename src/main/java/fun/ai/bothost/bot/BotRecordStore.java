package fun.ai.bothost.bot;

import fun.ai.bothost.bot.log.BotStatusBroadcaster;
import fun.ai.bothost.common.BotNotFoundException;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.enums.FunAiBotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * bot 记录的内存存储（id -> 记录）。
 * <p>
 * 对外只返回副本；修改通过 {@link #update} / {@link #transition} 在单 key 原子更新内完成，
 * 状态迁移事件也在同一原子块内发布，保证订阅者看到的顺序与迁移顺序一致。
 */
@Component
public class BotRecordStore {
    private static final Logger log = LoggerFactory.getLogger(BotRecordStore.class);

    private final ConcurrentHashMap<String, FunAiBot> bots = new ConcurrentHashMap<>();
    private final BotStatusBroadcaster statusBroadcaster;

    public BotRecordStore(BotStatusBroadcaster statusBroadcaster) {
        this.statusBroadcaster = statusBroadcaster;
    }

    /**
     * 新建记录：分配 id，初始状态 STOPPED；名称重复抛 IllegalArgumentException。
     */
    public synchronized FunAiBot create(FunAiBot draft) {
        if (draft == null || draft.getName() == null) {
            throw new IllegalArgumentException("bot 名称不能为空");
        }
        BotFileManager.validateBotName(draft.getName());
        if (findByName(draft.getName()).isPresent()) {
            throw new IllegalArgumentException("bot 名称已存在: " + draft.getName());
        }
        FunAiBot bot = draft.copy();
        long now = System.currentTimeMillis();
        bot.setId(UUID.randomUUID().toString());
        bot.setStatus(FunAiBotStatus.STOPPED);
        bot.setProcessId(null);
        bot.setRestartCount(0);
        bot.setCreatedAt(now);
        bot.setUpdatedAt(now);
        bots.put(bot.getId(), bot);
        log.info("bot created: botId={}, name={}", bot.getId(), bot.getName());
        return bot.copy();
    }

    public Optional<FunAiBot> find(String botId) {
        if (botId == null) {
            return Optional.empty();
        }
        FunAiBot bot = bots.get(botId);
        return bot == null ? Optional.empty() : Optional.of(snapshot(bot));
    }

    public FunAiBot require(String botId) {
        return find(botId).orElseThrow(() -> BotNotFoundException.bot(botId));
    }

    public Optional<FunAiBot> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return bots.values().stream()
                .filter(b -> name.equals(b.getName()))
                .findFirst()
                .map(this::snapshot);
    }

    public List<FunAiBot> list() {
        return bots.values().stream()
                .map(this::snapshot)
                .sorted(Comparator.comparing(FunAiBot::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * 修改非状态字段（status 的修改会被忽略，必须走 transition）。
     */
    public FunAiBot update(String botId, Consumer<FunAiBot> mutator) {
        FunAiBot updated = bots.computeIfPresent(botId, (id, current) -> {
            FunAiBot next = current.copy();
            mutator.accept(next);
            next.setId(current.getId());
            next.setName(current.getName());
            next.setStatus(current.getStatus());
            next.setUpdatedAt(System.currentTimeMillis());
            return next;
        });
        if (updated == null) {
            throw BotNotFoundException.bot(botId);
        }
        return snapshot(updated);
    }

    /**
     * 状态迁移（非法迁移抛 IllegalStateException），mutator 可为 null。
     */
    public FunAiBot transition(String botId, FunAiBotStatus target, Consumer<FunAiBot> mutator) {
        return transitionIfPresent(botId, target, mutator).orElseThrow(() -> BotNotFoundException.bot(botId));
    }

    /**
     * 同 {@link #transition}，但记录已被删除时返回 empty（退出回调与删除并发时使用）。
     */
    public Optional<FunAiBot> transitionIfPresent(String botId, FunAiBotStatus target, Consumer<FunAiBot> mutator) {
        FunAiBot updated = bots.computeIfPresent(botId, (id, current) -> {
            FunAiBotStatus from = current.getStatus();
            FunAiBotStatus to = from.transitionTo(target);
            FunAiBot next = current.copy();
            if (mutator != null) {
                mutator.accept(next);
            }
            next.setId(current.getId());
            next.setName(current.getName());
            next.setStatus(to);
            next.setUpdatedAt(System.currentTimeMillis());
            statusBroadcaster.publish(id, from, to);
            log.info("bot status: botId={}, name={}, {} -> {}", id, current.getName(), from, to);
            return next;
        });
        return Optional.ofNullable(updated).map(this::snapshot);
    }

    public synchronized boolean remove(String botId) {
        FunAiBot removed = bots.remove(botId);
        if (removed != null) {
            log.info("bot removed: botId={}, name={}", botId, removed.getName());
        }
        return removed != null;
    }

    public int size() {
        return bots.size();
    }

    private FunAiBot snapshot(FunAiBot bot) {
        return bot.copy();
    }
}
