package com.ryuqq.resea.core.contract;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 Action.
 *
 * <p>실행 동안 {@code <name>Loading} State 플래그가 true로 유지되며,
 * 완료/실패/취소 시 false로 복원됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncAction {

    /**
     * Action 실행 시작.
     *
     * @param ctx 실행 컨텍스트
     * @param args 호출 인자
     * @return 완료 단계 (null이면 즉시 완료로 간주)
     * @throws Exception 동기 구간의 사용자 코드 오류
     */
    CompletionStage<?> run(ActionContext ctx, Object[] args) throws Exception;
}
