package com.ryuqq.resea.core.contract;

/**
 * 동기 Action.
 *
 * <p>Action은 수신자({@link ActionContext})를 명시적으로 전달받아 State를 읽고 씁니다.</p>
 *
 * <pre>
 * Action increment = (ctx, args) -&gt; {
 *     int count = ctx.get("count");
 *     ctx.set("count", count + 1);
 *     return count + 1;
 * };
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Action {

    /**
     * Action 실행.
     *
     * @param ctx 실행 컨텍스트
     * @param args 호출 인자
     * @return 결과 (null 가능)
     * @throws Exception 사용자 코드 오류 (호출자에게 전파됨)
     */
    Object run(ActionContext ctx, Object[] args) throws Exception;
}
