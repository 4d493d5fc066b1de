package com.ryuqq.router.core.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * 자기 기술적(self-describing) 해시 값.
 *
 * <p>해시 함수 코드와 digest 바이트를 함께 보관하여,
 * 어떤 알고리즘으로 계산된 해시인지 값 자체로 알 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 digest를 복사하며, 조회 시에도 복사본을 반환합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>code: 0 이상</li>
 *   <li>digest: null 또는 빈 배열 불가, 최대 127 바이트</li>
 * </ul>
 *
 * @author Router Team
 * @since 1.0.0
 */
public final class Multihash {

    /** SHA2-256 해시 함수 코드. */
    public static final int SHA2_256 = 0x12;

    private static final int MAX_DIGEST_LENGTH = 127;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int code;
    private final byte[] digest;

    private Multihash(int code, byte[] digest) {
        if (code < 0) {
            throw new IllegalArgumentException("code cannot be negative (current: " + code + ")");
        }
        if (digest == null || digest.length == 0) {
            throw new IllegalArgumentException("digest cannot be null or empty");
        }
        if (digest.length > MAX_DIGEST_LENGTH) {
            throw new IllegalArgumentException("digest length cannot exceed " + MAX_DIGEST_LENGTH + " bytes");
        }
        this.code = code;
        this.digest = digest.clone();
    }

    /**
     * Multihash 생성.
     *
     * @param code 해시 함수 코드
     * @param digest 해시 digest
     * @return Multihash 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Multihash of(int code, byte[] digest) {
        return new Multihash(code, digest);
    }

    /**
     * 데이터의 SHA2-256 Multihash 계산.
     *
     * @param data 원본 데이터
     * @return SHA2-256 Multihash
     * @throws IllegalArgumentException data가 null인 경우
     */
    public static Multihash sha256(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return new Multihash(SHA2_256, md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public int getCode() {
        return code;
    }

    /**
     * digest 조회.
     *
     * @return digest 복사본
     */
    public byte[] getDigest() {
        return digest.clone();
    }

    /**
     * digest의 16진수 표현.
     *
     * @return 소문자 16진수 문자열
     */
    public String toHex() {
        char[] out = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            int v = digest[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Multihash that = (Multihash) o;
        return code == that.code && Arrays.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return 31 * code + Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return "Multihash{0x" + Integer.toHexString(code) + ":" + toHex() + '}';
    }
}
