package com.ryuqq.composite.core.node;

import com.ryuqq.composite.core.model.Payload;

import java.util.Optional;

/**
 * 자식이 없는 말단 노드.
 *
 * <p>Leaf는 실제 작업 단위를 수행하며, {@link #execute()}는 Payload를 텍스트로 반환합니다.
 * 기본 Leaf는 {@code "Leaf"}로 렌더링됩니다.</p>
 *
 * <p>자식 관리 연산을 노출하지 않습니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class Leaf implements Node {

    private final Payload payload;
    private Container parent;

    private Leaf(Payload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        this.payload = payload;
    }

    /**
     * 기본 Payload("Leaf")로 Leaf 생성.
     *
     * @return 부모가 없는 새 Leaf
     */
    public static Leaf create() {
        return new Leaf(Payload.defaultPayload());
    }

    /**
     * Payload를 지정하여 Leaf 생성.
     *
     * @param payload Payload
     * @return 부모가 없는 새 Leaf
     * @throws IllegalArgumentException payload가 null인 경우
     */
    public static Leaf of(Payload payload) {
        return new Leaf(payload);
    }

    /**
     * 문자열 Payload로 Leaf 생성.
     *
     * @param value Payload 값
     * @return 부모가 없는 새 Leaf
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public static Leaf of(String value) {
        return new Leaf(Payload.of(value));
    }

    public Payload getPayload() {
        return payload;
    }

    @Override
    public String execute() {
        return payload.getValue();
    }

    @Override
    public boolean isContainer() {
        return false;
    }

    @Override
    public Optional<Container> getParent() {
        return Optional.ofNullable(parent);
    }

    void setParent(Container parent) {
        this.parent = parent;
    }

    @Override
    public String toString() {
        return "Leaf{" + payload.getValue() + '}';
    }
}
