package com.ryuqq.resea.core.model;

/**
 * Store의 Registry 내 고유 식별자.
 *
 * <p>같은 Registry에서 같은 StoreId로 다시 정의를 요청하면 동일한 Store 인스턴스가
 * 반환됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class StoreId {

    private final String value;

    private StoreId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StoreId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("StoreId length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("StoreId cannot contain whitespace: '" + value + "'");
        }
        this.value = value;
    }

    /**
     * StoreId 생성.
     *
     * @param value StoreId 값
     * @return StoreId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StoreId of(String value) {
        return new StoreId(value);
    }

    /**
     * StoreId 값 조회.
     *
     * @return StoreId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoreId storeId = (StoreId) o;
        return value.equals(storeId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "StoreId{" + value + '}';
    }
}
