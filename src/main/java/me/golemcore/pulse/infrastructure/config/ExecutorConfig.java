package me.golemcore.pulse.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pools. Heartbeat decisions run on
 * {@code pulseEvaluationExecutor} so one slow decision call never serializes
 * unrelated tenants; async workflow runs use {@code pulseWorkflowExecutor}.
 * A full queue rejects the task; callers record the rejection instead of
 * running the work on their own thread.
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final PulseProperties properties;

    @Bean(name = "pulseEvaluationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pulseEvaluationExecutor() {
        PulseProperties.SchedulerProperties scheduler = properties.getScheduler();
        return boundedPool("pulse-eval", scheduler.getWorkers(), scheduler.getQueueCapacity());
    }

    @Bean(name = "pulseWorkflowExecutor", destroyMethod = "shutdownNow")
    public ExecutorService pulseWorkflowExecutor() {
        return boundedPool("pulse-workflow", properties.getWorkflow().getWorkers(),
                properties.getScheduler().getQueueCapacity());
    }

    private static ExecutorService boundedPool(String prefix, int workers, int queueCapacity) {
        int size = Math.max(1, workers);
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                daemonThreads(prefix),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
