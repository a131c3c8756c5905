package mytrader.worker.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps task types to handlers. Built once at startup and handed to the worker.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new LinkedHashMap<>();

    public synchronized HandlerRegistry register(String taskType, TaskHandler handler) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required for " + taskType);
        }
        TaskHandler previous = handlers.put(taskType, handler);
        if (previous != null) {
            log.warn("Handler for task type '{}' replaced", taskType);
        }
        return this;
    }

    /**
     * Register one handler under several task types, e.g. legacy names.
     */
    public HandlerRegistry register(TaskHandler handler, String... taskTypes) {
        for (String taskType : taskTypes) {
            register(taskType, handler);
        }
        return this;
    }

    public synchronized Optional<TaskHandler> find(String taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    public synchronized Set<String> taskTypes() {
        return Collections.unmodifiableSet(new LinkedHashMap<>(handlers).keySet());
    }

    public synchronized int size() {
        return handlers.size();
    }
}
