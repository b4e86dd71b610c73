package com.phillippitts.dictavault.testutil;

import com.phillippitts.dictavault.exception.ClassifierUnavailableException;
import com.phillippitts.dictavault.service.detect.llm.LanguageModelClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scriptable {@link LanguageModelClient}: returns a canned answer, throws, or blocks until
 * released.
 */
public class FakeLanguageModelClient implements LanguageModelClient {

    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private volatile String answer = "NONE";
    private volatile RuntimeException failure;
    private volatile CountDownLatch gate;
    private volatile boolean available = true;

    public FakeLanguageModelClient answering(String answer) {
        this.answer = answer;
        this.failure = null;
        return this;
    }

    public FakeLanguageModelClient failingWith(String reason) {
        this.failure = new ClassifierUnavailableException(reason, "scripted failure");
        return this;
    }

    public FakeLanguageModelClient failingWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    /**
     * Makes {@link #generate} block until {@link #release()} is called.
     */
    public FakeLanguageModelClient blocking() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch g = gate;
        if (g != null) {
            g.countDown();
        }
    }

    public FakeLanguageModelClient available(boolean available) {
        this.available = available;
        return this;
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    @Override
    public String generate(String prompt) {
        prompts.add(prompt);
        CountDownLatch g = gate;
        if (g != null) {
            try {
                g.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClassifierUnavailableException("interrupted", "generation interrupted", e);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return answer;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String getName() {
        return "fake";
    }
}
