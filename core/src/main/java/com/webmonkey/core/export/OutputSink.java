package com.webmonkey.core.export;

import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.PageResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 페이지 결과를 어딘가에 영속화한다. 반환값은 기록한 파일 목록. */
public interface OutputSink {
    List<Path> write(CanonicalUrl url, PageResult result) throws IOException;
}
