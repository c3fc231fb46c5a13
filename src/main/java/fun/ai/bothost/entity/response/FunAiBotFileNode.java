package fun.ai.bothost.entity.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;

@Data
public class FunAiBotFileNode {
    @Schema(description = "名称（不含路径）")
    private String name;

    @Schema(description = "相对 bot 根目录的路径（使用 / 分隔）")
    private String path;

    @Schema(description = "类型：FILE/DIR")
    private String type;

    @Schema(description = "文件大小（字节），DIR 为 null")
    private Long size;

    @Schema(description = "最后修改时间戳（ms）")
    private Long lastModifiedMs;

    @Schema(description = "子节点（仅 type=DIR）")
    private List<FunAiBotFileNode> children;
}
