package com.example.videostatcrawling.controller;

import com.example.videostatcrawling.service.scheduler.CrawlMode;
import com.example.videostatcrawling.service.scheduler.CrawlRunRequest;
import com.example.videostatcrawling.service.scheduler.CrawlScheduler;
import com.example.videostatcrawling.service.scheduler.CrawlStatusService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * CrawlingController 테스트
 */
@WebMvcTest(CrawlingController.class)
@ActiveProfiles("test")
class CrawlingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CrawlScheduler crawlScheduler;

    @MockBean
    private CrawlStatusService crawlStatusService;

    @Test
    void shouldStartRunWithRequestedParameters() throws Exception {
        mockMvc.perform(post("/crawl")
                        .param("mode", "heavy")
                        .param("identityId", "3")
                        .param("maxVideos", "10")
                        .param("maxTargets", "2")
                        .param("recrawl", "true"))
                .andExpect(status().isOk());

        ArgumentCaptor<CrawlRunRequest> captor = ArgumentCaptor.forClass(CrawlRunRequest.class);
        verify(crawlScheduler, timeout(2000)).run(captor.capture());
        CrawlRunRequest request = captor.getValue();
        assertThat(request.getMode()).isEqualTo(CrawlMode.HEAVY);
        assertThat(request.getIdentityId()).isEqualTo(3L);
        assertThat(request.getMaxVideosPerTarget()).isEqualTo(10);
        assertThat(request.getMaxTargets()).isEqualTo(2);
        assertThat(request.isRecrawl()).isTrue();
    }

    @Test
    void shouldRejectUnknownMode() throws Exception {
        mockMvc.perform(post("/crawl").param("mode", "everything"))
                .andExpect(status().isBadRequest());

        verify(crawlScheduler, never()).run(any());
    }

    @Test
    void shouldRejectOutOfRangeCounts() throws Exception {
        mockMvc.perform(post("/crawl").param("maxVideos", "0")).andExpect(status().isBadRequest());
        mockMvc.perform(post("/crawl").param("maxTargets", "101")).andExpect(status().isBadRequest());

        verify(crawlScheduler, never()).run(any());
    }

    @Test
    void shouldReturnStatusCounters() throws Exception {
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("aliveIdentities", 2L);
        counters.put("heavyRecords", 15L);
        when(crawlStatusService.getStatus()).thenReturn(counters);

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aliveIdentities").value(2))
                .andExpect(jsonPath("$.heavyRecords").value(15));
    }
}
