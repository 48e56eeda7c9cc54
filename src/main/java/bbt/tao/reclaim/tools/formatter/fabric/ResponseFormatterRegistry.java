package bbt.tao.reclaim.tools.formatter.fabric;

import bbt.tao.reclaim.tools.formatter.ToolResponseFormatter;
import org.springframework.core.ResolvableType;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
public class ResponseFormatterRegistry {
    private final Map<Class<?>, ToolResponseFormatter<?>> fmtType;

    public ResponseFormatterRegistry(List<ToolResponseFormatter<?>> list) {
        Map<Class<?>, ToolResponseFormatter<?>> map = new HashMap<>();
        for (ToolResponseFormatter<?> formatter : list) {
            ResolvableType rt = ResolvableType.forClass(formatter.getClass())
                    .as(ToolResponseFormatter.class);
            Class<?> responseType = rt.getGeneric(0).resolve();
            Objects.requireNonNull(responseType,
                    () -> "Could not resolve the response type of " + formatter.getClass());
            ToolResponseFormatter<?> previous = map.put(responseType, formatter);
            if (previous != null) {
                throw new IllegalStateException("Two formatters for " + responseType.getName() + ": "
                        + previous.getClass().getName() + " and " + formatter.getClass().getName());
            }
        }
        this.fmtType = Collections.unmodifiableMap(map);
    }

    @SuppressWarnings("unchecked")
    public <T> ToolResponseFormatter<T> getFormatter(Class<T> type) {
        ToolResponseFormatter<?> formatter = fmtType.get(type);
        if (formatter == null) {
            throw new IllegalArgumentException("No formatter found for type: " + type.getName());
        }
        return (ToolResponseFormatter<T>) formatter;
    }
}
