package com.anxietycompanion.service;

import com.anxietycompanion.model.domain.Conversation;
import com.anxietycompanion.model.domain.PipelineState;
import com.anxietycompanion.model.domain.SubmissionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedList;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes message handling per conversation.
 *
 * <p>Each conversation owns one runner with an {@code IDLE -> PROCESSING -> IDLE}
 * state machine and a FIFO backlog:</p>
 * <ul>
 * <li>A message submitted while idle starts a run immediately.</li>
 * <li>A message submitted while processing waits in the backlog; the backlog drains
 * one item at a time.</li>
 * <li>Text identical to the in-flight text, or to the previous submission within the
 * debounce window, is dropped.</li>
 * <li>A resend supersedes the in-flight run: its analysis result is discarded on
 * arrival and the resent text runs next, after any earlier resends still waiting.</li>
 * </ul>
 * <p>An idle runner with an empty backlog may be evicted; the next submission for
 * that conversation creates a fresh one.</p>
 * <p>Conversations never share a lock.</p>
 */
@Service
@Slf4j
public class ConversationPipeline {

    private final ConversationTurnProcessor turnProcessor;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;
    private final Duration debounceWindow;
    private final int maxBacklog;

    private final Map<UUID, PipelineRunner> runners = new ConcurrentHashMap<>();

    public ConversationPipeline(ConversationTurnProcessor turnProcessor,
                                @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
                                Clock clock,
                                @Value("${app.pipeline.debounce-ms:1500}") long debounceMs,
                                @Value("${app.pipeline.max-backlog:100}") int maxBacklog) {
        this.turnProcessor = turnProcessor;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
        this.debounceWindow = Duration.ofMillis(debounceMs);
        this.maxBacklog = maxBacklog;
    }

    public SubmissionOutcome submit(Conversation conversation, String text) {
        return submitTo(conversation, normalize(text), false);
    }

    /**
     * Edit/resend: supersedes the in-flight analysis and runs {@code text} next.
     */
    public SubmissionOutcome resend(Conversation conversation, String text) {
        return submitTo(conversation, normalize(text), true);
    }

    public PipelineState stateOf(UUID conversationId) {
        PipelineRunner runner = runners.get(conversationId);
        return runner != null ? runner.state() : PipelineState.IDLE;
    }

    public int backlogSize(UUID conversationId) {
        PipelineRunner runner = runners.get(conversationId);
        return runner != null ? runner.backlogSize() : 0;
    }

    /**
     * Removes the runner of an idle conversation. Returns {@code false} while a run is
     * in flight, messages are waiting, or the last submission is still inside the
     * debounce window.
     */
    public boolean evictIfIdle(UUID conversationId) {
        PipelineRunner runner = runners.get(conversationId);
        if (runner == null) {
            return true;
        }
        if (!runner.retireIfIdle(clock.instant())) {
            return false;
        }
        runners.remove(conversationId, runner);
        log.debug("[Pipeline] evicted idle runner: conversation={}", conversationId);
        return true;
    }

    private PipelineRunner runnerFor(Conversation conversation) {
        Objects.requireNonNull(conversation, "conversation");
        return runners.computeIfAbsent(conversation.getId(), id -> new PipelineRunner(conversation));
    }

    private SubmissionOutcome submitTo(Conversation conversation, String text, boolean supersede) {
        while (true) {
            SubmissionOutcome outcome = runnerFor(conversation).submit(text, supersede);
            if (outcome != null) {
                return outcome;
            }
            // runner was retired between lookup and lock
            runners.computeIfPresent(conversation.getId(), (id, runner) -> runner.isRetired() ? null : runner);
        }
    }

    private String normalize(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text is required");
        }
        return text.trim();
    }

    private final class PipelineRunner {

        private final Conversation conversation;
        private final Object lock = new Object();
        private final LinkedList<String> backlog = new LinkedList<>();
        private final AtomicLong requestTokens = new AtomicLong();

        private PipelineState state = PipelineState.IDLE;
        private String inFlightText;
        private String lastSubmittedText;
        private Instant lastSubmittedAt;
        // resends waiting at the head of the backlog, in submission order
        private int pendingResends;
        private boolean retired;

        private PipelineRunner(Conversation conversation) {
            this.conversation = conversation;
        }

        /**
         * Returns {@code null} when this runner has been retired and the caller must
         * look up a fresh one.
         */
        SubmissionOutcome submit(String text, boolean supersede) {
            Instant now = clock.instant();
            synchronized (lock) {
                if (retired) {
                    return null;
                }
                if (!supersede && isDuplicateLocked(text, now)) {
                    log.debug("[Pipeline] dropped duplicate submission: conversation={}", conversation.getId());
                    return SubmissionOutcome.DUPLICATE_DROPPED;
                }
                lastSubmittedText = text;
                lastSubmittedAt = now;

                if (supersede) {
                    requestTokens.incrementAndGet();
                }

                if (state == PipelineState.PROCESSING) {
                    if (supersede) {
                        backlog.add(pendingResends, text);
                        pendingResends++;
                    } else {
                        enqueueWithBoundLocked(text);
                    }
                    return SubmissionOutcome.QUEUED;
                }

                startRunLocked(text);
                return SubmissionOutcome.STARTED;
            }
        }

        PipelineState state() {
            synchronized (lock) {
                return state;
            }
        }

        int backlogSize() {
            synchronized (lock) {
                return backlog.size();
            }
        }

        boolean retireIfIdle(Instant now) {
            synchronized (lock) {
                if (state != PipelineState.IDLE || !backlog.isEmpty()) {
                    return false;
                }
                if (lastSubmittedAt != null && Duration.between(lastSubmittedAt, now).compareTo(debounceWindow) < 0) {
                    return false;
                }
                retired = true;
                return true;
            }
        }

        boolean isRetired() {
            synchronized (lock) {
                return retired;
            }
        }

        private boolean isDuplicateLocked(String text, Instant now) {
            if (text.equals(inFlightText)) {
                return true;
            }
            return text.equals(lastSubmittedText)
                    && lastSubmittedAt != null
                    && Duration.between(lastSubmittedAt, now).compareTo(debounceWindow) < 0;
        }

        private void enqueueWithBoundLocked(String text) {
            if (backlog.size() >= maxBacklog) {
                if (backlog.size() > pendingResends) {
                    backlog.remove(pendingResends);
                } else {
                    backlog.removeFirst();
                    pendingResends--;
                }
                log.warn("[Pipeline] backlog limit reached ({}), dropped oldest message: conversation={}",
                        maxBacklog, conversation.getId());
            }
            backlog.addLast(text);
        }

        private void startRunLocked(String text) {
            state = PipelineState.PROCESSING;
            inFlightText = text;
            long token = requestTokens.incrementAndGet();
            try {
                pipelineExecutor.submit(() -> run(text, token));
            } catch (RejectedExecutionException e) {
                state = PipelineState.IDLE;
                inFlightText = null;
                backlog.clear();
                pendingResends = 0;
                log.error("[Pipeline] executor rejected run: conversation={}", conversation.getId(), e);
            }
        }

        private void run(String text, long token) {
            try {
                turnProcessor.process(conversation, text, () -> requestTokens.get() == token);
            } catch (Exception e) { // must not kill the executor thread
                log.error("[Pipeline] run failed: conversation={}: {}", conversation.getId(), e.getMessage(), e);
            } finally {
                onRunComplete();
            }
        }

        private void onRunComplete() {
            synchronized (lock) {
                String next = backlog.pollFirst();
                if (pendingResends > 0) {
                    pendingResends--;
                }
                if (next == null) {
                    state = PipelineState.IDLE;
                    inFlightText = null;
                    return;
                }
                startRunLocked(next);
            }
        }
    }
}
