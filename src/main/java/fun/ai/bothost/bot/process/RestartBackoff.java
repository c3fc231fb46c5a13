package fun.ai.bothost.bot.process;

import java.time.Duration;

/**
 * 自动重启退避：delay(n) = min(base * 2^n, max)，n 为连续崩溃计数。
 */
public class RestartBackoff {
    private final Duration base;
    private final Duration max;
    private final Duration stableRunThreshold;

    public RestartBackoff(Duration base, Duration max, Duration stableRunThreshold) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("restart backoff base 必须大于 0");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("restart backoff max 不能小于 base");
        }
        this.base = base;
        this.max = max;
        this.stableRunThreshold = stableRunThreshold == null ? Duration.ZERO : stableRunThreshold;
    }

    public Duration delayFor(int attempt) {
        int n = Math.max(0, attempt);
        long baseMs = base.toMillis();
        long maxMs = max.toMillis();
        // 2^n 溢出前就已超过 max
        if (n >= 62 || baseMs > (maxMs >> Math.min(n, 62))) {
            return max;
        }
        return Duration.ofMillis(Math.min(maxMs, baseMs << n));
    }

    /**
     * 崩溃后的退避序号：本次运行超过稳定阈值则从 0 重新计数，否则沿用句柄上的连续重启次数。
     */
    public int attemptAfterCrash(int handleRestartCount, Duration uptime) {
        if (uptime != null && !stableRunThreshold.isZero() && uptime.compareTo(stableRunThreshold) >= 0) {
            return 0;
        }
        return Math.max(0, handleRestartCount);
    }
}
