package com.example.videostatcrawling.service.extract;

import com.example.videostatcrawling.entity.ExtractionMethod;
import com.example.videostatcrawling.entity.HeavyVideoRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * VideoPageExtractor 테스트
 */
class VideoPageExtractorTest {

    private static final LocalDateTime CRAWLED_AT = LocalDateTime.of(2024, 3, 10, 12, 0);
    private static final String URL = "https://www.tiktok.com/@pub/video/7312345678901234567";

    private final VideoPageExtractor extractor = new VideoPageExtractor();

    @Test
    void shouldExtractDetailPanel() {
        String panel = "<div class='DivBrowserModeContainer'>"
                + "<span data-e2e='browse-username'>pub</span>"
                + "<span data-e2e='browser-nickname'><span>Publisher</span><span> · </span><span>2d ago</span></span>"
                + "<div data-e2e='browse-video-desc'>hello world #tag</div>"
                + "<div data-e2e='browse-video'><video poster='https://cdn/poster.jpg'></video></div>"
                + "<strong data-e2e='browse-like-count'>12.3K</strong>"
                + "<strong data-e2e='browse-comment-count'>456</strong>"
                + "<strong data-e2e='undefined-count'>1,024</strong>"
                + "<strong data-e2e='share-count'>Share</strong>"
                + "<h4 data-e2e='browse-music'><a href='/music/song-1'>original sound - pub</a></h4>"
                + "</div>";

        HeavyVideoRecord record = extractor.extract(3L, URL, List.of(panel), CRAWLED_AT);

        assertThat(record).isNotNull();
        assertThat(record.getTargetAccountId()).isEqualTo(3L);
        assertThat(record.getVideoId()).isEqualTo("7312345678901234567");
        assertThat(record.getUrl()).isEqualTo(URL);
        assertThat(record.getAccountUsername()).isEqualTo("pub");
        assertThat(record.getAccountNickname()).isEqualTo("Publisher");
        assertThat(record.getTitle()).isEqualTo("hello world #tag");
        assertThat(record.getThumbnailUrl()).isEqualTo("https://cdn/poster.jpg");
        assertThat(record.getPostedAtText()).isEqualTo("2d ago");
        assertThat(record.getPostedAt()).isEqualTo(CRAWLED_AT.minusDays(2));
        assertThat(record.getLikeCount()).isEqualTo(12_300L);
        assertThat(record.getCommentCount()).isEqualTo(456L);
        assertThat(record.getCollectCount()).isEqualTo(1024L);
        assertThat(record.getShareCountText()).isEqualTo("Share");
        assertThat(record.getShareCount()).isNull();
        assertThat(record.getPlayCount()).isNull();
        assertThat(record.getMusicTitle()).isEqualTo("original sound - pub");
        assertThat(record.getMusicUrl()).isEqualTo("/music/song-1");
        assertThat(record.getExtractionMethod()).isEqualTo(ExtractionMethod.VIDEO_PAGE);
        assertThat(record.getCrawledAt()).isEqualTo(CRAWLED_AT);
    }

    @Test
    void shouldReturnNullWithoutPanel() {
        assertThat(extractor.extract(1L, URL, List.of(), CRAWLED_AT)).isNull();
    }

    @Test
    void shouldReturnNullWhenNeitherIdNorCountsPresent() {
        String panel = "<div><span data-e2e='browse-username'>pub</span></div>";

        assertThat(extractor.extract(1L, "https://www.tiktok.com/@pub", List.of(panel), CRAWLED_AT)).isNull();
    }

    @Test
    void shouldKeepRecordWithVideoIdOnly() {
        HeavyVideoRecord record = extractor.extract(1L, URL, List.of("<div></div>"), CRAWLED_AT);

        assertThat(record).isNotNull();
        assertThat(record.getLikeCountText()).isNull();
        assertThat(record.getAccountNickname()).isNull();
        assertThat(record.getPostedAt()).isNull();
    }
}
