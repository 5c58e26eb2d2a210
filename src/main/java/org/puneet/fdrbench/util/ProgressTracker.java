package org.puneet.fdrbench.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe progress counter for replicate fan-out. Reports at most once per
 * {@code reportEvery} completions, under the {@code PROGRESS} marker.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public class ProgressTracker {
    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);
    private static final Marker PROGRESS_MARKER = MarkerFactory.getMarker("PROGRESS");

    private final String taskName;
    private final int totalTasks;
    private final int reportEvery;
    private final AtomicInteger completedTasks = new AtomicInteger(0);
    private final AtomicInteger failedTasks = new AtomicInteger(0);
    private final AtomicLong startTime = new AtomicLong(System.currentTimeMillis());

    public ProgressTracker(String taskName, int totalTasks) {
        this.taskName = taskName;
        this.totalTasks = totalTasks;
        this.reportEvery = Math.max(1, totalTasks / 10);
        logger.info(PROGRESS_MARKER, "{}: starting {} tasks", taskName, totalTasks);
    }

    /**
     * Records one finished task.
     *
     * @param failed whether the task ended in failure
     */
    public void taskCompleted(boolean failed) {
        if (failed) {
            failedTasks.incrementAndGet();
        }
        int done = completedTasks.incrementAndGet();
        if (done % reportEvery == 0 || done == totalTasks) {
            long elapsed = System.currentTimeMillis() - startTime.get();
            logger.info(PROGRESS_MARKER, "{}: {}/{} ({}%) done, {} failed, {} elapsed",
                taskName, done, totalTasks, percent(done), failedTasks.get(), formatDuration(elapsed));
        }
    }

    public int getCompleted() {
        return completedTasks.get();
    }

    public int getFailed() {
        return failedTasks.get();
    }

    public int getTotal() {
        return totalTasks;
    }

    /**
     * Logs the closing summary line.
     */
    public void complete() {
        long elapsed = System.currentTimeMillis() - startTime.get();
        logger.info(PROGRESS_MARKER, "{}: finished {}/{} tasks ({} failed) in {}",
            taskName, completedTasks.get(), totalTasks, failedTasks.get(), formatDuration(elapsed));
    }

    private int percent(int done) {
        return totalTasks == 0 ? 100 : (int) Math.round(100.0 * done / totalTasks);
    }

    static String formatDuration(long millis) {
        long seconds = millis / 1000;
        if (seconds < 60) {
            return String.format("%d.%03ds", seconds, millis % 1000);
        }
        return String.format("%dm %02ds", seconds / 60, seconds % 60);
    }
}
