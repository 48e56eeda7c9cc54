package bbt.tao.reclaim.tools.formatter;

public interface ToolResponseFormatter<T> {
    String format(T response);
}
