package ch.mudcore.mudcorebackend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Configuration for task scheduling and background persistence.
 *
 * <p>Provides:
 * <ul>
 *   <li>a {@link TaskScheduler} used by @Scheduled methods (periodic player save) and for
 *       programmatic scheduling (grace-delayed teardown of a superseded connection)</li>
 *   <li>the {@code persistenceExecutor}, a single worker thread that serves as the
 *       relational write-behind queue</li>
 *   <li>the {@link Clock} used for session timing (transfer handover, play time)</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: 2 threads (periodic save + connection teardown timers)</li>
     *   <li>Thread name prefix: "mudcore-scheduler-" for easier debugging</li>
     *   <li>Pending timers are dropped on shutdown: teardown is cancellable only by process exit</li>
     * </ul>
     *
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("mudcore-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Single-threaded executor for relational reads and writes.
     *
     * <p>One worker keeps row writes in submission order. Queued writes are drained on
     * shutdown so a clean stop does not lose the last changes.
     *
     * @return configured executor
     */
    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("mudcore-persist-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
