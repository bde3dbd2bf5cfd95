package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.runtime.DispatchRuntime;
import com.ryuqq.provisioning.core.spi.NotificationOutbox;
import com.ryuqq.provisioning.core.spi.Notifier;
import com.ryuqq.provisioning.core.spi.OutboxMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 알림 outbox 소비자.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * outbox.dequeue(batchSize) → [msg1, msg2, ...]
 *   ↓
 * For each message (동시 처리, concurrency 제한):
 *   1. notifier.send(notification)
 *   2. 성공 → ack
 *   3. 실패 → attempt+1 < maxAttempts: retry(backoff)
 *            그 외: deadLetter (dlqEnabled=false면 로그 후 ack)
 *   ↓
 * 배치 처리 완료까지 대기 후 반환
 * </pre>
 *
 * <p>요청 상태를 읽거나 쓰지 않습니다. 발송 실패는 전이에 영향을 주지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class NotificationWorker implements DispatchRuntime {

    private static final Logger log = LoggerFactory.getLogger(NotificationWorker.class);

    private final NotificationOutbox outbox;
    private final Notifier notifier;
    private final NotificationWorkerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 BackoffCalculator 사용).
     *
     * @param outbox 알림 outbox
     * @param notifier 발송기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationWorker(NotificationOutbox outbox, Notifier notifier, NotificationWorkerConfig config) {
        this(outbox, notifier, config, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param outbox 알림 outbox
     * @param notifier 발송기
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationWorker(
        NotificationOutbox outbox,
        Notifier notifier,
        NotificationWorkerConfig config,
        BackoffCalculator backoffCalculator
    ) {
        if (outbox == null) {
            throw new IllegalArgumentException("outbox cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.outbox = outbox;
        this.notifier = notifier;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    @Override
    public int pump() {
        List<OutboxMessage> messages = outbox.dequeue(config.batchSize());
        if (messages.isEmpty()) {
            return 0;
        }

        List<Callable<Void>> tasks = messages.stream()
            .map(message -> (Callable<Void>) () -> {
                dispatch(message);
                return null;
            })
            .collect(Collectors.toList());

        int processed = 0;
        try {
            for (Future<Void> future : workerExecutor.invokeAll(tasks)) {
                try {
                    future.get();
                    processed++;
                } catch (ExecutionException e) {
                    log.error("Notification dispatch task failed unexpectedly", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Notification pump interrupted after {} of {} messages", processed, messages.size());
        }
        return processed;
    }

    /**
     * Worker 종료 (진행 중인 발송 완료 대기).
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private void dispatch(OutboxMessage message) {
        try {
            notifier.send(message.notification());
            outbox.ack(message);
            log.debug("Delivered {} notification {}", message.notification().kind(), message.messageId());
        } catch (RuntimeException e) {
            handleFailure(message, e);
        }
    }

    private void handleFailure(OutboxMessage message, RuntimeException error) {
        int attempts = message.attempt() + 1;
        if (attempts < config.maxAttempts()) {
            long delay = backoffCalculator.calculate(attempts);
            outbox.retry(message, delay);
            log.warn("Notification {} ({}) failed on attempt {}; retrying in {}ms",
                message.messageId(), message.notification().kind(), attempts, delay, error);
            return;
        }

        String reason = error.getClass().getSimpleName() + ": " + error.getMessage();
        if (config.dlqEnabled()) {
            outbox.deadLetter(message, reason);
            log.error("Notification {} ({}) moved to DLQ after {} attempts",
                message.messageId(), message.notification().kind(), attempts, error);
        } else {
            outbox.ack(message);
            log.error("Notification {} ({}) dropped after {} attempts",
                message.messageId(), message.notification().kind(), attempts, error);
        }
    }
}
