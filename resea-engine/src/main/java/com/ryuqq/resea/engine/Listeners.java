package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.store.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 구독자 목록.
 *
 * <p>등록 순서대로 통지하며, 통지 중 구독 해제가 가능하도록 {@link CopyOnWriteArrayList}를
 * 사용합니다. 같은 리스너를 두 번 등록해도 각각 독립된 등록으로 취급됩니다.</p>
 *
 * @param <L> 리스너 타입
 */
final class Listeners<L> {

    private static final Logger log = LoggerFactory.getLogger(Listeners.class);

    private final String description;
    private final List<Registration<L>> registrations = new CopyOnWriteArrayList<>();

    Listeners(String description) {
        this.description = description;
    }

    /**
     * 리스너 등록.
     *
     * @param listener 리스너
     * @return 멱등 구독 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    Subscription add(L listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Registration<L> registration = new Registration<>(listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * 모든 리스너에게 통지. 리스너 예외는 로깅 후 격리됩니다.
     *
     * @param notifier 리스너 호출 함수
     */
    void notifyEach(Consumer<L> notifier) {
        for (Registration<L> registration : registrations) {
            try {
                notifier.accept(registration.listener);
            } catch (RuntimeException e) {
                log.error("{} listener failed and was isolated: {}", description, registration.listener, e);
            }
        }
    }

    int size() {
        return registrations.size();
    }

    boolean isEmpty() {
        return registrations.isEmpty();
    }

    void clear() {
        registrations.clear();
    }

    private static final class Registration<L> {

        private final L listener;

        private Registration(L listener) {
            this.listener = listener;
        }
    }
}
