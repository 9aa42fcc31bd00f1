package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.entry.Entry;

import java.util.List;

/**
 * 검색 응답 (일반 검색과 휴지통 검색 공용).
 *
 * @param entries 일치한 엔트리
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record SearchResponse(List<Entry> entries) {

    public SearchResponse {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries = List.copyOf(entries);
    }
}
