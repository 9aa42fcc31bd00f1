package com.ryuqq.directory.core.modify;

import com.ryuqq.directory.core.entry.Entry;

/**
 * 단일 속성 변경.
 *
 * <ul>
 *   <li>{@link Present}: 값 추가</li>
 *   <li>{@link Removed}: 특정 값 제거</li>
 *   <li>{@link Purged}: 속성 전체 제거</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface Modify permits Modify.Present, Modify.Removed, Modify.Purged {

    /**
     * 대상 속성 이름.
     *
     * @return 속성 이름
     */
    String attr();

    /**
     * 변경을 Builder에 적용.
     *
     * @param builder 적용 대상
     */
    void applyTo(Entry.Builder builder);

    /**
     * 값 추가 (중복 제거 없음).
     *
     * @param attr 속성 이름
     * @param value 추가할 값
     */
    record Present(String attr, String value) implements Modify {
        public Present {
            requireAttr(attr);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public void applyTo(Entry.Builder builder) {
            builder.add(attr, value);
        }
    }

    /**
     * 같은 값을 모두 제거. 값이 남지 않으면 속성도 제거.
     *
     * @param attr 속성 이름
     * @param value 제거할 값
     */
    record Removed(String attr, String value) implements Modify {
        public Removed {
            requireAttr(attr);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public void applyTo(Entry.Builder builder) {
            builder.removeValue(attr, value);
        }
    }

    /**
     * 속성 전체 제거.
     *
     * @param attr 속성 이름
     */
    record Purged(String attr) implements Modify {
        public Purged {
            requireAttr(attr);
        }

        @Override
        public void applyTo(Entry.Builder builder) {
            builder.remove(attr);
        }
    }

    private static void requireAttr(String attr) {
        if (attr == null || attr.isBlank()) {
            throw new IllegalArgumentException("attr cannot be null or blank");
        }
    }
}
