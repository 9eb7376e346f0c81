package com.phillippitts.podcastbuddy.testutil;

import com.phillippitts.podcastbuddy.domain.ChatMessage;
import com.phillippitts.podcastbuddy.service.llm.LlmClient;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Scripted {@link LlmClient}.
 *
 * <p>Each {@link #streamChat(List)} call replays the current script:
 * <ul>
 *   <li>{@link #reply(String...)} - tokens to emit, in order</li>
 *   <li>{@link #tokenDelayMs(long)} - pause before each token</li>
 *   <li>{@link #failOnOpen(RuntimeException)} - throw from streamChat itself</li>
 *   <li>{@link #failAfter(int, RuntimeException)} - throw while iterating, after n tokens</li>
 *   <li>{@link #hangAfterTokens()} - never signal end of stream until closed</li>
 * </ul>
 * Pauses end early when the stream is closed, so cancellation tests stay fast.
 */
public class FakeLlmClient implements LlmClient {

    public final List<List<ChatMessage>> requests = new CopyOnWriteArrayList<>();
    public volatile boolean ready = true;
    public final AtomicInteger warmUps = new AtomicInteger();
    private final AtomicInteger closedStreams = new AtomicInteger();

    private volatile List<String> tokens = List.of();
    private volatile long tokenDelayMs;
    private volatile RuntimeException openFailure;
    private volatile RuntimeException streamFailure;
    private volatile int failAfter;
    private volatile boolean hang;

    /**
     * Replaces the scripted tokens and clears a previous {@link #hangAfterTokens()}.
     */
    public FakeLlmClient reply(String... tokens) {
        this.tokens = List.of(tokens);
        this.hang = false;
        return this;
    }

    public FakeLlmClient tokenDelayMs(long tokenDelayMs) {
        this.tokenDelayMs = tokenDelayMs;
        return this;
    }

    public FakeLlmClient failOnOpen(RuntimeException failure) {
        this.openFailure = failure;
        return this;
    }

    public FakeLlmClient failAfter(int tokenCount, RuntimeException failure) {
        this.failAfter = tokenCount;
        this.streamFailure = failure;
        return this;
    }

    public FakeLlmClient hangAfterTokens() {
        this.hang = true;
        return this;
    }

    public int closedStreams() {
        return closedStreams.get();
    }

    public List<ChatMessage> lastRequest() {
        return requests.get(requests.size() - 1);
    }

    @Override
    public Stream<String> streamChat(List<ChatMessage> messages) {
        requests.add(List.copyOf(messages));
        if (openFailure != null) {
            throw openFailure;
        }
        CountDownLatch closed = new CountDownLatch(1);
        List<String> script = tokens;
        long delay = tokenDelayMs;
        RuntimeException failure = streamFailure;
        int failIndex = failAfter;
        boolean hangAtEnd = hang;

        Iterator<String> iterator = new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                if (failure != null && index == failIndex) {
                    throw failure;
                }
                if (index < script.size()) {
                    return delay <= 0 || !await(closed, delay);
                }
                if (hangAtEnd) {
                    await(closed, TimeUnit.SECONDS.toMillis(30));
                }
                return false;
            }

            @Override
            public String next() {
                if (index >= script.size()) {
                    throw new NoSuchElementException();
                }
                return script.get(index++);
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(() -> {
                    if (closed.getCount() > 0) {
                        closed.countDown();
                        closedStreams.incrementAndGet();
                    }
                });
    }

    @Override
    public String chat(List<ChatMessage> messages) {
        requests.add(List.copyOf(messages));
        return String.join("", tokens).trim();
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public void warmUp() {
        warmUps.incrementAndGet();
    }

    @Override
    public String name() {
        return "fake-llm";
    }

    /**
     * @return true if the latch opened (stream closed) before the wait elapsed
     */
    private static boolean await(CountDownLatch latch, long millis) {
        try {
            return latch.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
