package com.webmonkey.core.util;

import com.webmonkey.core.model.PageResult;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 페이지 하나가 끝날 때마다 호출된다 (성공/실패 모두).
     * @param done    지금까지 처리한 페이지 수
     * @param pending 프런티어에 남은 항목 수
     * @param result  방금 끝난 페이지 결과
     */
    void onPage(long done, int pending, PageResult result);

    ProgressListener NONE = (d, p, r) -> {};
}
