package com.ryuqq.resea.core.contract;

import com.ryuqq.resea.core.model.StoreId;

/**
 * Action이 checked 예외로 실패했을 때 호출자에게 전달되는 예외.
 *
 * <p>unchecked 예외는 감싸지 않고 그대로 전파됩니다. 원래 예외는 {@link #getCause()}로
 * 확인할 수 있으며, ActionEvent에는 원래 예외가 기록됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class ActionFailedException extends RuntimeException {

    private final StoreId storeId;
    private final String action;

    /**
     * 생성자.
     *
     * @param storeId Store ID
     * @param action Action 이름
     * @param cause 원래 예외
     */
    public ActionFailedException(StoreId storeId, String action, Throwable cause) {
        super("Action '" + action + "' on store '" + storeId.getValue() + "' failed: " + cause.getMessage(), cause);
        this.storeId = storeId;
        this.action = action;
    }

    public StoreId getStoreId() {
        return storeId;
    }

    public String getAction() {
        return action;
    }
}
