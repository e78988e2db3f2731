package com.webmonkey.core.extract;

import com.webmonkey.core.model.Review;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * class 부분 문자열 매칭으로 리뷰를 찾는다.
 * 리뷰 블록: review|testimonial|comment, 내부 필드는 아래 상수 참고.
 * 플랫폼은 감지하지 않고 기본값(Amazon) 을 쓴다.
 */
public class ClassSubstringReviewHeuristic implements ReviewHeuristic {

    static final String[] BLOCK   = {"review", "testimonial", "comment"};
    static final String[] AUTHOR  = {"author", "reviewer", "user"};
    static final String[] DATE    = {"date", "time", "posted"};
    static final String[] RATING  = {"rating", "stars", "score"};
    static final String[] VERIFIED = {"verified"};
    static final String[] READ_MORE = {"read-more", "read more", "show more"};

    @Override
    public List<Review> reviews(Element mainRoot) {
        List<Review> out = new ArrayList<>();
        if (mainRoot == null) return out;
        List<Element> all = mainRoot.getAllElements();
        for (int i = 1; i < all.size(); i++) {            // 루트 자신은 제외
            Element el = all.get(i);
            if (!TextUtil.classContainsAny(el, BLOCK)) continue;

            Review.Builder b = Review.builder()
                    .author(textOf(el, AUTHOR))
                    .date(textOf(el, DATE))
                    .rating(textOf(el, RATING))
                    .verified(find(el, VERIFIED) != null);

            String text = TextUtil.strippedText(el);
            if (!text.isEmpty()) {
                b.text(text).readMore(find(el, READ_MORE) != null);
            }
            Review r = b.build();
            if (!r.isEmpty()) out.add(r);
        }
        return out;
    }

    private static Element find(Element root, String[] needles) {
        return TextUtil.firstDescendant(root, e -> TextUtil.classContainsAny(e, needles));
    }

    private static String textOf(Element root, String[] needles) {
        Element e = find(root, needles);
        return e == null ? "" : TextUtil.strippedText(e);
    }
}
