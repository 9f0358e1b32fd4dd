package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.core.contract.Action;
import com.ryuqq.resea.core.contract.ActionContext;
import com.ryuqq.resea.core.contract.ActionFailedException;
import com.ryuqq.resea.core.contract.AsyncAction;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.ActionEvent;
import com.ryuqq.resea.core.model.StoreId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Action 디스패처.
 *
 * <p>정의된 Action을 실행하고, 실행마다 정확히 하나의 {@link ActionEvent}를 발행합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>startTime 기록</li>
 *   <li>비동기 Action이면 {@code <name>Loading} 플래그를 true로 설정 (이미 true가 아닐 때만)</li>
 *   <li>Action 실행</li>
 *   <li>endTime 기록 → 로딩 플래그 복원 → ActionEvent 발행 (성공/실패/취소 모두 동일)</li>
 * </ol>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>unchecked 예외: 그대로 재전파</li>
 *   <li>checked 예외: {@link ActionFailedException}으로 감싸 전파</li>
 *   <li>ActionEvent에는 원본 예외가 기록됨</li>
 * </ul>
 *
 * <p><strong>취소:</strong> 반환된 Future를 취소하면 원본 Stage도 취소되며,
 * 로딩 플래그 복원과 이벤트 발행은 그대로 수행됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
final class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Store store;
    private final ActionContext context;
    private final Map<String, Action> actions;
    private final Map<String, AsyncAction> asyncActions;
    private final RegistryConfig config;
    private final Consumer<ActionEvent> eventSink;

    /**
     * 생성자.
     *
     * @param store 소유 Store (로딩 플래그 관리용)
     * @param context Action 수신자
     * @param definition Store 정의
     * @param config Registry 설정
     * @param eventSink ActionEvent 발행 대상
     */
    ActionDispatcher(Store store, ActionContext context, StoreDefinition definition,
                     RegistryConfig config, Consumer<ActionEvent> eventSink) {
        this.store = store;
        this.context = context;
        this.actions = definition.actions();
        this.asyncActions = definition.asyncActions();
        this.config = config;
        this.eventSink = eventSink;
    }

    /**
     * Action 디스패치.
     *
     * @param name Action 이름
     * @param args 인자
     * @return 동기 Action은 결과, 비동기 Action은 추적 중인 Future
     * @throws IllegalArgumentException 존재하지 않는 Action인 경우
     */
    Object dispatch(String name, Object[] args) {
        Action action = actions.get(name);
        if (action != null) {
            return runSync(name, action, copyArgs(args));
        }
        AsyncAction asyncAction = asyncActions.get(name);
        if (asyncAction != null) {
            return runAsync(name, asyncAction, copyArgs(args));
        }
        throw unknownAction(name);
    }

    /**
     * Action 비동기 디스패치. 동기 Action의 결과와 예외는 완료된 Future로 감쌉니다.
     *
     * @param name Action 이름
     * @param args 인자
     * @return 결과 Future
     * @throws IllegalArgumentException 존재하지 않는 Action인 경우
     */
    CompletableFuture<Object> dispatchAsync(String name, Object[] args) {
        AsyncAction asyncAction = asyncActions.get(name);
        if (asyncAction != null) {
            return runAsync(name, asyncAction, copyArgs(args));
        }
        Action action = actions.get(name);
        if (action == null) {
            throw unknownAction(name);
        }
        try {
            return CompletableFuture.completedFuture(runSync(name, action, copyArgs(args)));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Object runSync(String name, Action action, Object[] args) {
        long startTime = System.nanoTime();
        Object result;
        try {
            result = action.run(context, args);
        } catch (RuntimeException | Error e) {
            fail(name, args, startTime, e);
            throw e;
        } catch (Exception e) {
            fail(name, args, startTime, e);
            throw new ActionFailedException(store.id(), name, e);
        }
        emit(ActionEvent.succeeded(store.id(), name, args, result, startTime, System.nanoTime()));
        return result;
    }

    private CompletableFuture<Object> runAsync(String name, AsyncAction action, Object[] args) {
        long startTime = System.nanoTime();
        boolean loadingSet = markLoading(name);

        CompletableFuture<?> raw;
        try {
            CompletionStage<?> stage = action.run(context, args);
            if (stage == null) {
                throw new IllegalStateException(
                    String.format("Async action '%s' in store %s returned no stage", name, store.id().getValue())
                );
            }
            raw = stage.toCompletableFuture();
        } catch (Error e) {
            settleEarlyFailure(name, args, startTime, loadingSet, e);
            throw e;
        } catch (Exception e) {
            settleEarlyFailure(name, args, startTime, loadingSet, e);
            return CompletableFuture.failedFuture(propagated(name, e));
        }

        CompletableFuture<Object> tracked = new CompletableFuture<>();
        raw.whenComplete((result, error) -> {
            Throwable cause = unwrap(error);
            try {
                long endTime = System.nanoTime();
                clearLoading(name, loadingSet);
                if (cause == null) {
                    emit(ActionEvent.succeeded(store.id(), name, args, result, startTime, endTime));
                } else {
                    logFailure(name, cause);
                    emit(ActionEvent.failed(store.id(), name, args, cause, startTime, endTime));
                }
            } finally {
                if (cause == null) {
                    tracked.complete(result);
                } else {
                    tracked.completeExceptionally(propagated(name, cause));
                }
            }
        });
        tracked.whenComplete((result, error) -> {
            if (tracked.isCancelled()) {
                raw.cancel(true);
            }
        });
        return tracked;
    }

    private void settleEarlyFailure(String name, Object[] args, long startTime, boolean loadingSet, Throwable error) {
        long endTime = System.nanoTime();
        clearLoading(name, loadingSet);
        logFailure(name, error);
        emit(ActionEvent.failed(store.id(), name, args, error, startTime, endTime));
    }

    private void fail(String name, Object[] args, long startTime, Throwable error) {
        long endTime = System.nanoTime();
        logFailure(name, error);
        emit(ActionEvent.failed(store.id(), name, args, error, startTime, endTime));
    }

    private boolean markLoading(String name) {
        if (!config.trackAsyncLoading()) {
            return false;
        }
        String key = config.loadingKey(name);
        if (Boolean.TRUE.equals(store.get(key))) {
            return false;
        }
        store.setState(Map.of(key, Boolean.TRUE));
        return Boolean.TRUE.equals(store.get(key));
    }

    private void clearLoading(String name, boolean loadingSet) {
        if (loadingSet) {
            store.setState(Map.of(config.loadingKey(name), Boolean.FALSE));
        }
    }

    private void emit(ActionEvent event) {
        eventSink.accept(event);
    }

    private void logFailure(String name, Throwable error) {
        log.error("Action {}.{} failed", store.id().getValue(), name, error);
    }

    private Throwable propagated(String name, Throwable cause) {
        if (cause instanceof RuntimeException || cause instanceof Error) {
            return cause;
        }
        return new ActionFailedException(store.id(), name, cause);
    }

    private IllegalArgumentException unknownAction(String name) {
        StoreId id = store.id();
        return new IllegalArgumentException(
            String.format("Unknown action '%s' in store %s", name, id.getValue())
        );
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static Object[] copyArgs(Object[] args) {
        return args == null ? new Object[0] : args.clone();
    }
}
