package com.phillippitts.dictavault.config;

import com.phillippitts.dictavault.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.classifierExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(2);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("classifier-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldRejectTasksBeyondPoolAndQueueCapacity() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getClassifier().setCorePoolSize(1);
        properties.getClassifier().setMaxPoolSize(1);
        properties.getClassifier().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).classifierExecutor();

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        AtomicReference<String> overflowThread = new AtomicReference<>();
        try {
            executor.execute(blocker);
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            executor.execute(blocker);

            // a third task never falls back to the submitting thread
            assertThatThrownBy(() -> executor.execute(() -> overflowThread.set(Thread.currentThread().getName())))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(overflowThread.get()).isNull();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).classifierExecutor();
        ThreadContext.put("sessionId", "s-42");

        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
        assertThat(threadName.get()).startsWith("classifier-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put("documentId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("documentId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("documentId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("documentId")).isEqualTo("worker");
    }
}
