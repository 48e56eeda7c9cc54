package bbt.tao.reclaim.conf;

import bbt.tao.reclaim.tools.meta.TaskToolMeta;
import bbt.tao.reclaim.tools.meta.TaskToolMetadata;
import bbt.tao.reclaim.tools.meta.TaskToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Configuration
public class ToolCallBackProviderConfig {

    private static final String NO_TOOL_BEANS_MESSAGE = "No beans with @Tool and @TaskToolMeta methods were found";

    @Bean
    public TaskToolRegistry taskToolRegistry(ApplicationContext applicationContext) {
        List<Object> toolBeans = new ArrayList<>();
        Map<String, TaskToolMetadata> metadata = new HashMap<>();

        for (String beanName : applicationContext.getBeanDefinitionNames()) {
            Class<?> beanType = applicationContext.getType(beanName);
            if (beanType == null || !declaresToolMeta(ClassUtils.getUserClass(beanType))) {
                continue;
            }

            Object bean = applicationContext.getBean(beanName);
            Class<?> targetClass = AopUtils.getTargetClass(bean);

            boolean beanRegistered = false;
            for (Method method : targetClass.getMethods()) {
                Tool tool = method.getAnnotation(Tool.class);
                TaskToolMeta meta = method.getAnnotation(TaskToolMeta.class);

                if (tool == null && meta != null) {
                    log.warn("Method {}.{} has @TaskToolMeta without @Tool and is ignored", targetClass.getSimpleName(), method.getName());
                    continue;
                }

                if (tool == null) {
                    continue;
                }

                if (meta == null) {
                    log.warn("Method {}.{} has @Tool but no @TaskToolMeta; the tool is not registered", targetClass.getSimpleName(), method.getName());
                    continue;
                }

                String toolName = resolveToolName(tool, method);
                TaskToolMetadata current = new TaskToolMetadata(beanName, method.getName(), toolName);

                TaskToolMetadata previous = metadata.putIfAbsent(toolName, current);
                if (previous != null) {
                    log.error("Two tools share the name '{}': {}.{} and {}.{}. The second one is ignored.",
                            toolName,
                            previous.beanName(), previous.methodName(),
                            targetClass.getSimpleName(), method.getName());
                    continue;
                }

                log.info("Registered tool '{}' (bean='{}', method='{}')", toolName, beanName, method.getName());
                if (!beanRegistered) {
                    toolBeans.add(bean);
                    beanRegistered = true;
                }
            }
        }

        if (toolBeans.isEmpty()) {
            throw new IllegalStateException(NO_TOOL_BEANS_MESSAGE);
        }

        return new TaskToolRegistry(toolBeans, metadata);
    }

    @Bean
    public ToolCallbackProvider reclaimToolCallbackProvider(TaskToolRegistry registry) {
        Object[] beans = registry.toolBeans().toArray();
        if (beans.length == 0) {
            throw new IllegalStateException(NO_TOOL_BEANS_MESSAGE);
        }
        return MethodToolCallbackProvider.builder()
                .toolObjects(beans)
                .build();
    }

    private static boolean declaresToolMeta(Class<?> type) {
        for (Method method : type.getMethods()) {
            if (method.isAnnotationPresent(TaskToolMeta.class)) {
                return true;
            }
        }
        return false;
    }

    private String resolveToolName(Tool tool, Method method) {
        if (StringUtils.hasText(tool.name())) {
            return tool.name();
        }
        return method.getName().toLowerCase(Locale.ROOT);
    }
}
