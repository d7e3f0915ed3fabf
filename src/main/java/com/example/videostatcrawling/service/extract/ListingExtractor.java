package com.example.videostatcrawling.service.extract;

import com.example.videostatcrawling.service.merge.BackHalfFragment;
import com.example.videostatcrawling.service.merge.FrontHalfFragment;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 목록 화면 아이템(outerHTML 조각)을 Jsoup 으로 파싱하여 앞/뒤 절반 조각을 만듭니다.
 */
@Slf4j
@Component
public class ListingExtractor {

    private static final String LINK = "a[href]";
    private static final String THUMBNAIL = "img[src]";
    private static final String LIKE_COUNT = "[data-e2e='video-likes']";
    private static final String PLAY_COUNT = "[data-e2e='video-views']";

    /**
     * 게시자 페이지 아이템 → 앞 절반 (목록 순서 유지, 최신 max 개)
     * 
     * 링크가 없는 아이템(광고, 로딩 중 자리표시 등)은 건너뜁니다.
     *
     * @param itemFragments 게시자 페이지 아이템 outerHTML
     * @param max 최대 개수
     */
    public List<FrontHalfFragment> frontHalves(List<String> itemFragments, int max) {
        List<FrontHalfFragment> fronts = new ArrayList<>();
        for (String fragment : itemFragments) {
            if (fronts.size() >= max) {
                break;
            }
            Document doc = Jsoup.parseBodyFragment(fragment);
            Element link = doc.selectFirst(LINK);
            if (link == null) {
                log.debug("링크가 없는 목록 아이템을 건너뜁니다.");
                continue;
            }
            String url = link.attr("abs:href").isEmpty() ? link.attr("href") : link.attr("abs:href");
            Element img = doc.selectFirst(THUMBNAIL);
            fronts.add(FrontHalfFragment.builder()
                    .url(url)
                    .videoId(VideoUrls.videoIdOf(url))
                    .thumbnailUrl(img == null ? null : img.attr("src"))
                    .altText(img == null ? null : img.attr("alt"))
                    .likeCountText(textOrNull(doc.selectFirst(LIKE_COUNT)))
                    .build());
        }
        return fronts;
    }

    /**
     * 크리에이터 피드 아이템 → 뒤 절반 (썸네일이 없는 아이템은 키가 없으므로 제외)
     */
    public List<BackHalfFragment> backHalves(List<String> itemFragments) {
        List<BackHalfFragment> backs = new ArrayList<>();
        for (String fragment : itemFragments) {
            Document doc = Jsoup.parseBodyFragment(fragment);
            Element img = doc.selectFirst(THUMBNAIL);
            if (img == null) {
                continue;
            }
            backs.add(BackHalfFragment.builder()
                    .thumbnailUrl(img.attr("src"))
                    .playCountText(textOrNull(doc.selectFirst(PLAY_COUNT)))
                    .build());
        }
        return backs;
    }

    static String textOrNull(Element el) {
        return el == null ? null : el.text();
    }
}
