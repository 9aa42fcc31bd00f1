package com.ryuqq.directory.core.contract;

import com.ryuqq.directory.core.entry.Entry;

import java.util.Arrays;
import java.util.List;

/**
 * 생성 요청. 하나 이상의 완전한 엔트리를 전달합니다.
 *
 * <p>빈 목록은 생성자에서 막지 않고, 서버가 {@code EmptyRequest}로 응답합니다.</p>
 *
 * @param entries 생성할 엔트리
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record CreateRequest(List<Entry> entries) {

    public CreateRequest {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries = List.copyOf(entries);
    }

    public static CreateRequest of(Entry... entries) {
        return new CreateRequest(Arrays.asList(entries));
    }
}
