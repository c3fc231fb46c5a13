package fun.ai.bothost.common;

public class MissingBuildRecipeException extends BotHostException {
    public MissingBuildRecipeException(String botName, String recipeFileName) {
        super(BotErrorCode.MISSING_BUILD_RECIPE, "仓库根目录缺少 " + recipeFileName + ": " + botName);
    }
}
