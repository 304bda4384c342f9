package com.lbg.markets.etl.watcher.config;

/**
 * Where and how units of work are enqueued.
 * <p>
 * {@code destinationKwargs} adds the routed table, schema and source labels to the task's keyword
 * arguments. Leave it off for tasks that only declare {@code auto_triggered} and {@code filepath},
 * such as the default {@code process_excel_file}, which reject unknown keywords.
 */
public record DispatchSettings(
        DispatchMode mode,
        String queue,
        String taskName,
        String sourceTag,
        boolean destinationKwargs
) {
    public static final String DEFAULT_QUEUE = "celery";
    public static final String DEFAULT_TASK = "etl_processor.tasks.process_excel_file";
    public static final String DEFAULT_SOURCE_TAG = "file_watcher";

    public DispatchSettings {
        if (mode == null) {
            throw new IllegalArgumentException("Dispatch mode cannot be null");
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue name cannot be blank");
        }
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be blank");
        }
        sourceTag = sourceTag != null && !sourceTag.isBlank() ? sourceTag : DEFAULT_SOURCE_TAG;
    }

    public DispatchSettings(DispatchMode mode, String queue, String taskName, String sourceTag) {
        this(mode, queue, taskName, sourceTag, false);
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings(DispatchMode.RAW, DEFAULT_QUEUE, DEFAULT_TASK, DEFAULT_SOURCE_TAG);
    }
}
