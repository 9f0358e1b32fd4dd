package com.ryuqq.resea.application.registry;

import com.ryuqq.resea.core.model.ActionEvent;

/**
 * Action 이벤트 구독자.
 *
 * <p>구독자에서 발생한 예외는 로깅 후 격리되며, Action 호출자에게 전파되지 않습니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionListener {

    /**
     * Action 완료 통지 (성공/실패 모두).
     *
     * @param event 완료된 Action 이벤트
     */
    void onAction(ActionEvent event);
}
