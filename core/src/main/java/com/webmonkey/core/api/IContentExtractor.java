package com.webmonkey.core.api;

import com.webmonkey.core.model.PageDocument;
import com.webmonkey.core.model.PageSnapshot;

/** DOM 스냅샷 → 문서 모델. 구현은 순수 함수여야 한다 (I/O 없음). */
public interface IContentExtractor {
    PageDocument extract(PageSnapshot snapshot);
}
