package bbt.tao.reclaim.tools.meta;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class TaskToolRegistry {

    private final List<Object> toolBeans;
    private final Map<String, TaskToolMetadata> metadataByToolName;

    public TaskToolRegistry(List<Object> toolBeans, Map<String, TaskToolMetadata> metadataByToolName) {
        this.toolBeans = List.copyOf(toolBeans);
        this.metadataByToolName = Collections.unmodifiableMap(metadataByToolName);
    }

    public List<Object> toolBeans() {
        return toolBeans;
    }

    public TaskToolMetadata metadata(String toolName) {
        return metadataByToolName.get(toolName);
    }

    public Set<String> toolNames() {
        return Collections.unmodifiableSet(new TreeSet<>(metadataByToolName.keySet()));
    }
}
