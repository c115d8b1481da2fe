package com.ryuqq.composite.core.model;

/**
 * Leaf가 수행하는 작업 단위의 결과값.
 *
 * <p>Payload는 Leaf가 {@code execute()} 시 텍스트로 반환하는 원자값입니다.
 * 서로 다른 Payload를 가진 Leaf는 서로 다르게 렌더링됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>기본 Payload: {@code Payload.defaultPayload()} → "Leaf"</li>
 *   <li>사용자 정의: {@code Payload.of("price:100")}</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>렌더링 문법 예약 문자 ({@code +}, {@code (}, {@code )}) 사용 불가</li>
 * </ul>
 *
 * <p><strong>예약 문자:</strong> 렌더링 문법은 {@code Leaf | Branch(<node>{+<node>})}입니다.
 * {@code +}는 형제 구분자, {@code (}와 {@code )}는 Branch 경계이므로 Payload 값에 포함되면
 * 결과 문자열만으로 트리 구조를 구분할 수 없습니다.
 * 예: {@code Payload.of("a+b")}를 허용하면 {@code Branch(a+b)}가 Leaf 1개인지 2개인지 알 수 없습니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class Payload {

    /**
     * 기본 Leaf 렌더링 값.
     */
    public static final String DEFAULT_VALUE = "Leaf";

    private static final Payload DEFAULT = new Payload(DEFAULT_VALUE);

    private final String value;

    private Payload(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payload cannot be null or blank");
        }
        if (value.indexOf('+') >= 0 || value.indexOf('(') >= 0 || value.indexOf(')') >= 0) {
            throw new IllegalArgumentException(
                "Payload contains reserved characters of the Branch(...) grammar ('+', '(', ')'): " + value
            );
        }
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value Payload 값
     * @return Payload 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Payload of(String value) {
        if (DEFAULT_VALUE.equals(value)) {
            return DEFAULT;
        }
        return new Payload(value);
    }

    /**
     * 기본 Payload ("Leaf").
     *
     * @return 기본 Payload 인스턴스
     */
    public static Payload defaultPayload() {
        return DEFAULT;
    }

    /**
     * Payload 값 조회.
     *
     * @return Payload 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 기본 Payload인지 확인.
     *
     * @return 값이 "Leaf"이면 true
     */
    public boolean isDefault() {
        return DEFAULT_VALUE.equals(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value + '}';
    }
}
