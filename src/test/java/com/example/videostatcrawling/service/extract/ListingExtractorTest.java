package com.example.videostatcrawling.service.extract;

import com.example.videostatcrawling.service.merge.BackHalfFragment;
import com.example.videostatcrawling.service.merge.FrontHalfFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * ListingExtractor 테스트
 */
class ListingExtractorTest {

    private final ListingExtractor extractor = new ListingExtractor();

    @Test
    void shouldExtractFrontHalvesInListingOrder() {
        List<String> items = List.of(
                item("https://www.tiktok.com/@pub/video/111", "https://cdn/1.jpg", "first video", "1.2K"),
                item("https://www.tiktok.com/@pub/video/222", "https://cdn/2.jpg", "second video", "980"));

        List<FrontHalfFragment> fronts = extractor.frontHalves(items, 10);

        assertThat(fronts)
                .extracting(FrontHalfFragment::getVideoId, FrontHalfFragment::getThumbnailUrl,
                        FrontHalfFragment::getAltText, FrontHalfFragment::getLikeCountText)
                .containsExactly(
                        tuple("111", "https://cdn/1.jpg", "first video", "1.2K"),
                        tuple("222", "https://cdn/2.jpg", "second video", "980"));
        assertThat(fronts.get(0).getUrl()).isEqualTo("https://www.tiktok.com/@pub/video/111");
    }

    @Test
    void shouldLimitToNewestItems() {
        List<String> items = List.of(
                item("https://www.tiktok.com/@pub/video/1", "a.jpg", "a", "1"),
                item("https://www.tiktok.com/@pub/video/2", "b.jpg", "b", "2"),
                item("https://www.tiktok.com/@pub/video/3", "c.jpg", "c", "3"));

        assertThat(extractor.frontHalves(items, 2)).extracting(FrontHalfFragment::getVideoId).containsExactly("1", "2");
    }

    @Test
    void shouldSkipItemsWithoutLink() {
        List<String> items = List.of(
                "<div data-e2e='user-post-item'><div class='placeholder'></div></div>",
                item("https://www.tiktok.com/@pub/video/9", "z.jpg", "z", "5K"));

        assertThat(extractor.frontHalves(items, 1)).extracting(FrontHalfFragment::getVideoId).containsExactly("9");
    }

    @Test
    void shouldKeepMissingFieldsAsNull() {
        List<FrontHalfFragment> fronts = extractor.frontHalves(
                List.of("<div data-e2e='user-post-item'><a href='/@pub/photo/5'></a></div>"), 5);

        assertThat(fronts).hasSize(1);
        assertThat(fronts.get(0).getVideoId()).isNull();
        assertThat(fronts.get(0).getThumbnailUrl()).isNull();
        assertThat(fronts.get(0).getLikeCountText()).isNull();
    }

    @Test
    void shouldExtractBackHalvesAndDropItemsWithoutThumbnail() {
        List<String> items = List.of(
                "<div data-e2e='creator-feed-item'><img src='https://cdn/1.jpg'><strong data-e2e='video-views'>1.5M</strong></div>",
                "<div data-e2e='creator-feed-item'><strong data-e2e='video-views'>3K</strong></div>",
                "<div data-e2e='creator-feed-item'><img src='https://cdn/2.jpg'></div>");

        List<BackHalfFragment> backs = extractor.backHalves(items);

        assertThat(backs)
                .extracting(BackHalfFragment::getThumbnailUrl, BackHalfFragment::getPlayCountText)
                .containsExactly(tuple("https://cdn/1.jpg", "1.5M"), tuple("https://cdn/2.jpg", null));
    }

    private static String item(String href, String src, String alt, String likes) {
        return "<div data-e2e='user-post-item'><a href='" + href + "'><img src='" + src + "' alt='" + alt + "'>"
                + "<strong data-e2e='video-likes'>" + likes + "</strong></a></div>";
    }
}
