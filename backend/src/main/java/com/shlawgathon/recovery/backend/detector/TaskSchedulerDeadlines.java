package com.shlawgathon.recovery.backend.detector;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link SessionDeadlines} on top of Spring's {@link TaskScheduler}.
 */
@Component
public class TaskSchedulerDeadlines implements SessionDeadlines {

    private final TaskScheduler taskScheduler;

    public TaskSchedulerDeadlines(@Qualifier("sessionDeadlineScheduler") TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable onDeadline) {
        ScheduledFuture<?> future = taskScheduler.schedule(onDeadline, Instant.now().plus(delay));
        return () -> future.cancel(false);
    }
}
