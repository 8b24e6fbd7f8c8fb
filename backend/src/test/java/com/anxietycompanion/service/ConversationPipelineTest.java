package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.CompanionPersona;
import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.Language;
import com.anxietycompanion.model.domain.PipelineState;
import com.anxietycompanion.model.domain.SubmissionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ConversationPipelineTest {

    private static final long DEBOUNCE_MS = 1500;

    private ConversationTurnProcessor processor;
    private ExecutorService executor;
    private MutableClock clock;
    private Conversation conversation;
    private List<String> processed;

    @BeforeEach
    void setUp() {
        processor = mock(ConversationTurnProcessor.class);
        executor = Executors.newSingleThreadExecutor();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        conversation = Conversation.start(CompanionPersona.VANESSA, Language.EN, clock.instant());
        processed = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldProcessMessagesInSubmissionOrder() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(3);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("A")) {
                gateA.await();
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(conversation, "A"));
        gateA.awaitStarted();
        assertEquals(SubmissionOutcome.QUEUED, pipeline.submit(conversation, "B"));
        assertEquals(SubmissionOutcome.QUEUED, pipeline.submit(conversation, "C"));
        assertEquals(PipelineState.PROCESSING, pipeline.stateOf(conversation.getId()));
        assertEquals(2, pipeline.backlogSize(conversation.getId()));

        gateA.release();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(List.of("A", "B", "C"), processed);
        assertEquals(PipelineState.IDLE, pipeline.stateOf(conversation.getId()));
        assertEquals(0, pipeline.backlogSize(conversation.getId()));
    }

    @Test
    void shouldDropIdenticalTextWithinDebounceWindow() throws Exception {
        Gate gate = new Gate();
        doAnswer(inv -> {
            gate.await();
            processed.add(inv.getArgument(1));
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(conversation, "I feel tense"));
        assertEquals(SubmissionOutcome.DUPLICATE_DROPPED, pipeline.submit(conversation, "  I feel tense "));

        gate.release();
        awaitIdle(pipeline);
        clock.advance(Duration.ofMillis(DEBOUNCE_MS - 1));
        assertEquals(SubmissionOutcome.DUPLICATE_DROPPED, pipeline.submit(conversation, "I feel tense"));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        verify(processor, times(1)).process(eq(conversation), eq("I feel tense"), any(BooleanSupplier.class));
    }

    @Test
    void shouldAcceptIdenticalTextAfterDebounceWindow() throws Exception {
        CountDownLatch done = new CountDownLatch(2);
        doAnswer(inv -> {
            processed.add(inv.getArgument(1));
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(conversation, "hello"));
        awaitIdle(pipeline);
        clock.advance(Duration.ofMillis(DEBOUNCE_MS));
        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(conversation, "hello"));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("hello", "hello"), processed);
    }

    @Test
    void shouldSupersedeInFlightRunOnResend() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(3);
        AtomicBoolean firstStillCurrent = new AtomicBoolean(true);
        AtomicBoolean resentCurrent = new AtomicBoolean(false);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            BooleanSupplier isCurrent = inv.getArgument(2);
            if (text.equals("A")) {
                gateA.await();
                firstStillCurrent.set(isCurrent.getAsBoolean());
            } else if (text.equals("A edited")) {
                resentCurrent.set(isCurrent.getAsBoolean());
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        pipeline.submit(conversation, "A");
        gateA.awaitStarted();
        pipeline.submit(conversation, "B");
        assertEquals(SubmissionOutcome.QUEUED, pipeline.resend(conversation, "A edited"));

        gateA.release();
        assertTrue(done.await(5, TimeUnit.SECONDS));

        assertFalse(firstStillCurrent.get());
        assertTrue(resentCurrent.get());
        assertEquals(List.of("A", "A edited", "B"), processed);
    }

    @Test
    void shouldStartResendImmediatelyWhenIdle() {
        ConversationPipeline pipeline = pipeline(100);

        assertEquals(SubmissionOutcome.STARTED, pipeline.resend(conversation, "edited text"));
    }

    @Test
    void shouldRunResendsInSubmissionOrder() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(4);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("A")) {
                gateA.await();
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        pipeline.submit(conversation, "A");
        gateA.awaitStarted();
        pipeline.submit(conversation, "B");
        pipeline.resend(conversation, "first edit");
        pipeline.resend(conversation, "second edit");
        assertEquals(3, pipeline.backlogSize(conversation.getId()));

        gateA.release();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("A", "first edit", "second edit", "B"), processed);
    }

    @Test
    void shouldEvictRunnerOnlyWhenIdle() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(2);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("A")) {
                gateA.await();
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        pipeline.submit(conversation, "A");
        gateA.awaitStarted();
        assertFalse(pipeline.evictIfIdle(conversation.getId()));

        gateA.release();
        awaitIdle(pipeline);
        assertFalse(pipeline.evictIfIdle(conversation.getId()));

        clock.advance(Duration.ofMillis(DEBOUNCE_MS + 1));
        assertTrue(pipeline.evictIfIdle(conversation.getId()));

        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(conversation, "B"));
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("A", "B"), processed);
    }

    @Test
    void shouldDropOldestWhenBacklogIsFull() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(3);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("A")) {
                gateA.await();
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(2);

        pipeline.submit(conversation, "A");
        gateA.awaitStarted();
        pipeline.submit(conversation, "B");
        pipeline.submit(conversation, "C");
        pipeline.submit(conversation, "D");
        assertEquals(2, pipeline.backlogSize(conversation.getId()));

        gateA.release();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("A", "C", "D"), processed);
    }

    @Test
    void shouldContinueWithBacklogAfterFailedRun() throws Exception {
        Gate gateA = new Gate();
        CountDownLatch done = new CountDownLatch(1);
        doAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("A")) {
                gateA.await();
                throw new IllegalStateException("boom");
            }
            processed.add(text);
            done.countDown();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        pipeline.submit(conversation, "A");
        gateA.awaitStarted();
        pipeline.submit(conversation, "B");

        gateA.release();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("B"), processed);
    }

    @Test
    void shouldKeepConversationsIndependent() throws Exception {
        Conversation other = Conversation.start(CompanionPersona.MONICA, Language.ES, clock.instant());
        Gate gateA = new Gate();
        doAnswer(inv -> {
            gateA.await();
            return null;
        }).when(processor).process(eq(conversation), anyString(), any(BooleanSupplier.class));

        ConversationPipeline pipeline = pipeline(100);

        pipeline.submit(conversation, "same text");
        gateA.awaitStarted();

        assertEquals(SubmissionOutcome.STARTED, pipeline.submit(other, "same text"));
        assertEquals(PipelineState.IDLE, pipeline.stateOf(UUID.randomUUID()));
        gateA.release();
    }

    @Test
    void shouldRejectBlankText() {
        ConversationPipeline pipeline = pipeline(100);

        assertThrows(IllegalArgumentException.class, () -> pipeline.submit(conversation, "   "));
    }

    private ConversationPipeline pipeline(int maxBacklog) {
        return new ConversationPipeline(processor, executor, clock, DEBOUNCE_MS, maxBacklog);
    }

    private void awaitIdle(ConversationPipeline pipeline) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pipeline.stateOf(conversation.getId()) != PipelineState.IDLE) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("pipeline did not become idle");
            }
            Thread.sleep(10);
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private static final class Gate {
        private final Object lock = new Object();
        private boolean released = false;
        private boolean started = false;

        void await() throws InterruptedException {
            synchronized (lock) {
                started = true;
                lock.notifyAll();
                while (!released) {
                    lock.wait();
                }
            }
        }

        void awaitStarted() throws InterruptedException {
            synchronized (lock) {
                while (!started) {
                    lock.wait();
                }
            }
        }

        void release() {
            synchronized (lock) {
                released = true;
                lock.notifyAll();
            }
        }
    }
}
