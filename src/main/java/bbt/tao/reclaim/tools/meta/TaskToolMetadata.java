package bbt.tao.reclaim.tools.meta;

public record TaskToolMetadata(
        String beanName,
        String methodName,
        String toolName
) {
}
