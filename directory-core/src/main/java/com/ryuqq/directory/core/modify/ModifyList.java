package com.ryuqq.directory.core.modify;

import com.ryuqq.directory.core.entry.Entry;

import java.util.Arrays;
import java.util.List;

/**
 * 순서가 있는 속성 변경 목록.
 *
 * <p>변경은 왼쪽에서 오른쪽으로 적용되며, 같은 속성에 대한 뒤의 변경이 앞의 변경을
 * 덮어쓸 수 있습니다 (예: Present 뒤의 Purged). 순서는 의미가 있으므로 그대로 보존됩니다.</p>
 *
 * @param mods 변경 목록 (순서 유지)
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record ModifyList(List<Modify> mods) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException mods가 null이거나 null 요소를 포함한 경우
     */
    public ModifyList {
        if (mods == null) {
            throw new IllegalArgumentException("mods cannot be null");
        }
        for (Modify mod : mods) {
            if (mod == null) {
                throw new IllegalArgumentException("mods cannot contain null");
            }
        }
        mods = List.copyOf(mods);
    }

    public static ModifyList of(Modify... mods) {
        return new ModifyList(Arrays.asList(mods));
    }

    public boolean isEmpty() {
        return mods.isEmpty();
    }

    /**
     * 엔트리에 변경을 순서대로 적용한 새 엔트리 생성.
     *
     * @param entry 원본 엔트리 (변경되지 않음)
     * @return 변경이 적용된 엔트리
     * @throws IllegalArgumentException entry가 null인 경우
     */
    public Entry applyTo(Entry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        Entry.Builder builder = entry.toBuilder();
        for (Modify mod : mods) {
            mod.applyTo(builder);
        }
        return builder.build();
    }
}
