package com.example.videostatcrawling.service.merge;

import com.example.videostatcrawling.entity.ExtractionMethod;
import com.example.videostatcrawling.entity.LightVideoRecord;
import com.example.videostatcrawling.service.text.ParsedValue;
import com.example.videostatcrawling.service.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 앞 절반/뒤 절반 조각을 썸네일 키로 병합하여 LightVideoRecord 를 만듭니다.
 * 
 * 병합 규칙:
 * - 앞 절반의 모든 키가 정확히 한 번씩, 앞 절반 순서대로 출력됨
 * - 같은 키의 뒤 절반이 있으면 재생 수를 채우고, 없으면 재생 수는 null
 * - 뒤 절반에만 있는 키는 붙일 곳이 없으므로 버림
 * - 키 비교는 완전 일치만 사용
 * 
 * 같은 키의 조각이 여러 개면 파싱 값이 가장 큰 것(같으면 원문 사전순)을 고릅니다.
 * 앞 절반은 좋아요 수, 뒤 절반은 재생 수 기준이며, 따라서 입력 순서와 무관하게 결과가 같습니다.
 * 출력 위치는 앞 절반에서 해당 키가 처음 나온 위치입니다.
 */
@Component
public class LightRecordMerger {

    private static final Comparator<BackHalfFragment> BACK_HALF_PREFERENCE = Comparator
            .comparing((BackHalfFragment b) -> TextNormalizer.parseCount(b.getPlayCountText()).getValue(),
                    Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(BackHalfFragment::getPlayCountText, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<FrontHalfFragment> FRONT_HALF_PREFERENCE = Comparator
            .comparing((FrontHalfFragment f) -> TextNormalizer.parseCount(f.getLikeCountText()).getValue(),
                    Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(FrontHalfFragment::getLikeCountText, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(FrontHalfFragment::getUrl, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(FrontHalfFragment::getAltText, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * @param targetAccountId 수집 대상 계정 ID
     * @param fronts 게시자 페이지 목록 순서의 앞 절반
     * @param backs 크리에이터 피드에서 찾은 뒤 절반 (순서 무관)
     * @param crawledAt 수집 시간
     * @return 병합된 레코드 (앞 절반 순서 유지)
     */
    public List<LightVideoRecord> merge(Long targetAccountId, List<FrontHalfFragment> fronts,
                                        List<BackHalfFragment> backs, LocalDateTime crawledAt) {
        Map<String, BackHalfFragment> backByKey = new HashMap<>();
        for (BackHalfFragment back : backs) {
            if (back.getThumbnailUrl() == null) {
                continue;
            }
            backByKey.merge(back.getThumbnailUrl(), back,
                    (existing, candidate) -> BACK_HALF_PREFERENCE.compare(candidate, existing) > 0 ? candidate : existing);
        }

        Map<String, FrontHalfFragment> frontByKey = new HashMap<>();
        for (FrontHalfFragment front : fronts) {
            if (front.getThumbnailUrl() == null) {
                continue;
            }
            frontByKey.merge(front.getThumbnailUrl(), front,
                    (existing, candidate) -> FRONT_HALF_PREFERENCE.compare(candidate, existing) > 0 ? candidate : existing);
        }

        Set<String> seenKeys = new HashSet<>();
        List<LightVideoRecord> merged = new ArrayList<>();
        for (FrontHalfFragment listed : fronts) {
            String key = listed.getThumbnailUrl();
            if (key != null && !seenKeys.add(key)) {
                continue;
            }
            // 같은 키가 여러 번 나오면 위치는 처음 나온 곳, 내용은 우선순위가 가장 높은 조각
            FrontHalfFragment front = key == null ? listed : frontByKey.get(key);
            BackHalfFragment back = key == null ? null : backByKey.get(key);
            ParsedValue<Long> likes = TextNormalizer.parseCount(front.getLikeCountText());
            ParsedValue<Long> plays = TextNormalizer.parseCount(back == null ? null : back.getPlayCountText());
            merged.add(LightVideoRecord.builder()
                    .targetAccountId(targetAccountId)
                    .videoId(front.getVideoId())
                    .url(front.getUrl())
                    .thumbnailUrl(key)
                    .altText(front.getAltText())
                    .likeCountText(likes.getRaw())
                    .likeCount(likes.getValue())
                    .playCountText(plays.getRaw())
                    .playCount(plays.getValue())
                    .crawledAt(crawledAt)
                    .extractionMethod(ExtractionMethod.PUBLISHER_LISTING_MERGE)
                    .build());
        }
        return merged;
    }

    /**
     * 앞 절반 키 중 뒤 절반에서 이미 찾은 키의 개수
     */
    public long matchedCount(List<FrontHalfFragment> fronts, List<BackHalfFragment> backs) {
        Set<String> backKeys = new HashSet<>();
        for (BackHalfFragment back : backs) {
            backKeys.add(back.getThumbnailUrl());
        }
        return fronts.stream()
                .map(FrontHalfFragment::getThumbnailUrl)
                .filter(Objects::nonNull)
                .distinct()
                .filter(backKeys::contains)
                .count();
    }
}
