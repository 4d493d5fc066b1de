package com.ryuqq.router.core.model;

/**
 * 네트워크 Peer 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 불가</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class PeerId {

    private final String value;

    private PeerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PeerId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("PeerId length cannot exceed 255 characters");
        }
        if (!value.matches("^\\S+$")) {
            throw new IllegalArgumentException("PeerId cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * PeerId 생성.
     *
     * @param value PeerId 값
     * @return PeerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PeerId of(String value) {
        return new PeerId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PeerId peerId = (PeerId) o;
        return value.equals(peerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PeerId{" + value + '}';
    }
}
