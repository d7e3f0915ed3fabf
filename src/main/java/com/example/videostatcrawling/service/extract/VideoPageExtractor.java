package com.example.videostatcrawling.service.extract;

import com.example.videostatcrawling.entity.ExtractionMethod;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import com.example.videostatcrawling.service.text.ParsedValue;
import com.example.videostatcrawling.service.text.TextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

import static com.example.videostatcrawling.service.extract.ListingExtractor.textOrNull;

/**
 * 동영상 페이지 상세 패널(outerHTML)을 파싱하여 HeavyVideoRecord 를 만듭니다.
 * 
 * 동영상 페이지에는 재생 수가 표시되지 않으므로 playCount 는 비워 두고,
 * 세션이 같은 동영상의 Light 레코드에서 채웁니다.
 */
@Component
public class VideoPageExtractor {

    private static final String USERNAME = "[data-e2e='browse-username']";
    /** 닉네임 · 게시일 순서의 span 묶음 */
    private static final String NICKNAME_LINE = "[data-e2e='browser-nickname'] > span";
    private static final String TITLE = "[data-e2e='browse-video-desc']";
    private static final String THUMBNAIL = "[data-e2e='browse-video'] img[src]";
    private static final String VIDEO_POSTER = "video[poster]";
    private static final String LIKE_COUNT = "[data-e2e='browse-like-count']";
    private static final String COMMENT_COUNT = "[data-e2e='browse-comment-count']";
    private static final String COLLECT_COUNT = "[data-e2e='undefined-count']";
    private static final String SHARE_COUNT = "[data-e2e='share-count']";
    private static final String MUSIC_LINK = "[data-e2e='browse-music'] a";

    /**
     * @param targetAccountId 수집 대상 계정 ID
     * @param url 현재 동영상 URL
     * @param panelFragments 상세 패널 outerHTML (첫 번째만 사용)
     * @param crawledAt 수집 시간
     * @return 추출 결과 (동영상 ID 도 숫자 항목도 없으면 null)
     */
    public HeavyVideoRecord extract(Long targetAccountId, String url, List<String> panelFragments, LocalDateTime crawledAt) {
        if (panelFragments.isEmpty()) {
            return null;
        }
        Document doc = Jsoup.parseBodyFragment(panelFragments.get(0));

        ParsedValue<Long> likes = TextNormalizer.parseCount(textOrNull(doc.selectFirst(LIKE_COUNT)));
        ParsedValue<Long> comments = TextNormalizer.parseCount(textOrNull(doc.selectFirst(COMMENT_COUNT)));
        ParsedValue<Long> collects = TextNormalizer.parseCount(textOrNull(doc.selectFirst(COLLECT_COUNT)));
        ParsedValue<Long> shares = TextNormalizer.parseCount(textOrNull(doc.selectFirst(SHARE_COUNT)));
        String videoId = VideoUrls.videoIdOf(url);

        if (videoId == null && likes.getRaw() == null && comments.getRaw() == null
                && collects.getRaw() == null && shares.getRaw() == null) {
            return null;
        }

        Elements nicknameLine = doc.select(NICKNAME_LINE);
        String nickname = nicknameLine.isEmpty() ? null : nicknameLine.first().text();
        String postedAtText = nicknameLine.size() > 1 ? nicknameLine.last().text() : null;
        ParsedValue<LocalDateTime> postedAt = TextNormalizer.parseDate(postedAtText, crawledAt);

        Element music = doc.selectFirst(MUSIC_LINK);

        return HeavyVideoRecord.builder()
                .targetAccountId(targetAccountId)
                .videoId(videoId)
                .url(url)
                .accountUsername(textOrNull(doc.selectFirst(USERNAME)))
                .accountNickname(nickname)
                .title(textOrNull(doc.selectFirst(TITLE)))
                .thumbnailUrl(thumbnailOf(doc))
                .postedAtText(postedAt.getRaw())
                .postedAt(postedAt.getValue())
                .likeCountText(likes.getRaw())
                .likeCount(likes.getValue())
                .commentCountText(comments.getRaw())
                .commentCount(comments.getValue())
                .collectCountText(collects.getRaw())
                .collectCount(collects.getValue())
                .shareCountText(shares.getRaw())
                .shareCount(shares.getValue())
                .musicTitle(music == null ? null : music.text())
                .musicUrl(music == null ? null : music.attr("href"))
                .crawledAt(crawledAt)
                .extractionMethod(ExtractionMethod.VIDEO_PAGE)
                .build();
    }

    private String thumbnailOf(Document doc) {
        Element img = doc.selectFirst(THUMBNAIL);
        if (img != null) {
            return img.attr("src");
        }
        Element video = doc.selectFirst(VIDEO_POSTER);
        return video == null ? null : video.attr("poster");
    }
}
