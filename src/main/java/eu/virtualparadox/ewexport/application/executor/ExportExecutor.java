package eu.virtualparadox.ewexport.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated single-worker executor for background batch exports.
 */
public class ExportExecutor extends ThreadPoolTaskExecutor {
}
