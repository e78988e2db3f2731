package com.webmonkey.core.extract;

import com.webmonkey.core.model.Review;
import org.jsoup.nodes.Element;

import java.util.List;

/** 본문 루트에서 리뷰/후기 블록을 뽑는 전략 */
public interface ReviewHeuristic {
    List<Review> reviews(Element mainRoot);
}
