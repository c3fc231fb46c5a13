package fun.ai.bothost.bot;

import java.util.Arrays;
import java.util.List;

public class CommandResult {
    public static final int TIMEOUT_EXIT_CODE = 124;

    private final int exitCode;
    private final String output;

    public CommandResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public boolean isTimeout() {
        return exitCode == TIMEOUT_EXIT_CODE;
    }

    /**
     * 输出按行拆分（去掉空行），用于写入部署日志 / 失败异常。
     */
    public List<String> outputLines() {
        return Arrays.stream(output.split("\\R"))
                .filter(s -> !s.isBlank())
                .toList();
    }
}
