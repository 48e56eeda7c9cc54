package bbt.tao.reclaim.aop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.AfterThrowing;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.CodeSignature;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Aspect
@Component
public class ToolInvocationLoggingAspect {

    private final ObjectMapper mapper;

    public ToolInvocationLoggingAspect(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Pointcut("within(bbt.tao.reclaim.tools..*) && @annotation(tool)")
    public void toolCall(Tool tool) {}

    @Before("toolCall(tool)")
    public void logToolRequest(JoinPoint joinPoint, Tool tool) {
        try {
            log.info("[TOOL-REQUEST] {} -> {}", tool.name(), mapper.writeValueAsString(arguments(joinPoint)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize arguments of tool {}", tool.name(), e);
        }
    }

    @AfterReturning(pointcut = "toolCall(tool)", returning = "result")
    public void logToolResponse(Tool tool, Object result) {
        log.info("[TOOL-RESPONSE] {} -> {} chars", tool.name(), result == null ? 0 : result.toString().length());
        log.debug("[TOOL-RESPONSE] {} body -> {}", tool.name(), result);
    }

    @AfterThrowing(pointcut = "toolCall(tool)", throwing = "error")
    public void logToolFailure(Tool tool, Throwable error) {
        log.warn("[TOOL-ERROR] {} -> {}", tool.name(), error.getMessage());
    }

    private Map<String, Object> arguments(JoinPoint joinPoint) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        String[] names = ((CodeSignature) joinPoint.getSignature()).getParameterNames();
        Object[] values = joinPoint.getArgs();
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                arguments.put(names != null && i < names.length ? names[i] : "arg" + i, values[i]);
            }
        }
        return arguments;
    }
}
