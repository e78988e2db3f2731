package com.webmonkey.core.api;

import com.webmonkey.core.model.PageDocument;

/** 문서 모델 → 문자열 표현. 같은 입력이면 같은 출력. */
public interface IDocumentRenderer {
    String render(PageDocument doc);
}
