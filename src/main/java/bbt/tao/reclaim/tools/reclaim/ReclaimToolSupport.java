package bbt.tao.reclaim.tools.reclaim;

import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.exception.ToolCallFailedException;
import bbt.tao.reclaim.tools.formatter.fabric.ResponseFormatterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
abstract class ReclaimToolSupport {

    protected final ResponseFormatterRegistry formatterRegistry;

    protected ReclaimToolSupport(ResponseFormatterRegistry formatterRegistry) {
        this.formatterRegistry = formatterRegistry;
    }

    /**
     * Runs {@code call}, waits for its result and formats it with the formatter registered for {@code type}.
     * Any failure, including one thrown while building the call, is rethrown as a
     * {@link ToolCallFailedException} carrying the rendered error text.
     */
    protected <T> String execute(String toolName, Supplier<Mono<T>> call, Class<T> type) {
        return execute(toolName, call, result -> formatterRegistry.getFormatter(type).format(result));
    }

    protected <T> String execute(String toolName, Supplier<Mono<T>> call, Function<T, String> formatter) {
        try {
            T result = call.get()
                    .subscribeOn(Schedulers.boundedElastic())
                    .toFuture()
                    .get();
            return formatter.apply(result);
        } catch (ExecutionException e) {
            throw failure(toolName, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(toolName, e);
        } catch (RuntimeException e) {
            throw failure(toolName, e);
        }
    }

    protected static long requireTaskId(Long taskId) {
        if (taskId == null || taskId <= 0) {
            throw new InvalidInputException("taskId must be a positive integer.");
        }
        return taskId;
    }

    /**
     * {@code timeZone} wins over its lower-case alias {@code timezone}.
     */
    protected static String timeZone(String timeZone, String timezoneAlias) {
        if (timeZone != null && !timeZone.isBlank()) {
            return timeZone;
        }
        return timezoneAlias != null && !timezoneAlias.isBlank() ? timezoneAlias : null;
    }

    private ToolCallFailedException failure(String toolName, Throwable error) {
        String text = formatterRegistry.getFormatter(Throwable.class).format(error);
        log.error("Tool {} failed: {}", toolName, text, error);
        return new ToolCallFailedException(text, error);
    }
}
