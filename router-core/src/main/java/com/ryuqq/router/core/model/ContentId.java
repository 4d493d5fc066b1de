package com.ryuqq.router.core.model;

/**
 * 콘텐츠 식별자.
 *
 * <p>데이터 내용으로부터 계산된 불투명(opaque) 키로,
 * Provider 광고 및 조회의 대상이 되는 데이터 단위를 식별합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class ContentId {

    private final Multihash hash;

    private ContentId(Multihash hash) {
        if (hash == null) {
            throw new IllegalArgumentException("hash cannot be null");
        }
        this.hash = hash;
    }

    /**
     * Multihash로부터 ContentId 생성.
     *
     * @param hash 콘텐츠 해시
     * @return ContentId 인스턴스
     * @throws IllegalArgumentException hash가 null인 경우
     */
    public static ContentId of(Multihash hash) {
        return new ContentId(hash);
    }

    /**
     * 데이터 내용의 SHA2-256 해시로 ContentId 생성.
     *
     * @param data 콘텐츠 데이터
     * @return ContentId 인스턴스
     * @throws IllegalArgumentException data가 null인 경우
     */
    public static ContentId of(byte[] data) {
        return new ContentId(Multihash.sha256(data));
    }

    /**
     * 콘텐츠 해시 조회.
     *
     * @return Multihash (non-null)
     */
    public Multihash hash() {
        return hash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentId that = (ContentId) o;
        return hash.equals(that.hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "ContentId{" + hash.toHex() + '}';
    }
}
