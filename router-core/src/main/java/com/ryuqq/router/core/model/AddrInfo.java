package com.ryuqq.router.core.model;

import java.util.List;

/**
 * Peer와 그 Peer에 도달할 수 있는 주소 목록.
 *
 * <p>{@link #EMPTY}는 "찾지 못함"을 나타내는 값으로, id가 null입니다.
 * 조회 결과가 비어있는지는 {@link #isEmpty()}로 확인합니다.</p>
 *
 * @param id Peer 식별자 (EMPTY인 경우에만 null)
 * @param addrs 주소 목록 (예: /ip4/10.0.0.1/tcp/4001)
 *
 * @author Router Team
 * @since 1.0.0
 */
public record AddrInfo(PeerId id, List<String> addrs) {

    /** 비어있는 AddrInfo. */
    public static final AddrInfo EMPTY = new AddrInfo(null, List.of());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException addrs에 null 원소가 있는 경우
     */
    public AddrInfo {
        if (addrs == null) {
            addrs = List.of();
        }
        for (String addr : addrs) {
            if (addr == null) {
                throw new IllegalArgumentException("addrs cannot contain null");
            }
        }
        addrs = List.copyOf(addrs);
    }

    /**
     * AddrInfo 생성.
     *
     * @param id Peer 식별자
     * @param addrs 주소 목록
     * @return AddrInfo 인스턴스
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static AddrInfo of(PeerId id, String... addrs) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return new AddrInfo(id, List.of(addrs));
    }

    /**
     * 비어있는 결과인지 확인.
     *
     * @return id가 없으면 true
     */
    public boolean isEmpty() {
        return id == null;
    }
}
