package com.fenci.interfaces.api;

import com.fenci.application.segment.SegmentAppService;
import com.fenci.application.segment.SegmentResult;
import com.fenci.application.segment.exception.TextTooLongException;
import com.fenci.domain.segment.model.ConflictRecord;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentMode;
import com.fenci.domain.segment.model.SegmentOverrides;
import com.fenci.infrastructure.segmentation.rule.RuleConfigurationException;
import com.fenci.interfaces.api.segment.SegmentController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SegmentControllerTest {

    @Mock
    private SegmentAppService segmentAppService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SegmentController(segmentAppService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void segment_returns_tokens() throws Exception {
        when(segmentAppService.segment(eq("Hello123"), eq("smart"), any(SegmentOverrides.class)))
                .thenReturn(new SegmentResult(SegmentMode.SMART, List.of("Hello", "123")));

        mockMvc.perform(post("/api/v1/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hello123\",\"mode\":\"smart\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("smart"))
                .andExpect(jsonPath("$.tokens[1]").value("123"));
    }

    @Test
    void missing_text_is_a_validation_error() throws Exception {
        mockMvc.perform(post("/api/v1/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"smart\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void oversized_random_length_rejected() throws Exception {
        mockMvc.perform(post("/api/v1/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"abc\",\"mode\":\"random\",\"options\":{\"randomMinLength\":2000000000}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("randomMinLength must not exceed 10000"));
    }

    @Test
    void too_long_text() throws Exception {
        when(segmentAppService.segment(any(), any(), any()))
                .thenThrow(new TextTooLongException(30000, 20000));

        mockMvc.perform(post("/api/v1/segment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\"}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.code").value("TEXT_TOO_LONG"));
    }

    @Test
    void multi_reports_conflicts() throws Exception {
        when(segmentAppService.resolveRules(anyList())).thenReturn(Set.of());
        when(segmentAppService.composeRules(eq("a,b"), eq(List.of("symbolSplit", "removeSymbols")), any()))
                .thenReturn(new MultiRuleResult(List.of("ab"), List.of(RuleId.REMOVE_SYMBOLS),
                        List.of(ConflictRecord.skipped(RuleId.SYMBOL_SPLIT, "removeSymbols conflicts with symbolSplit, symbolSplit skipped")),
                        MultiRuleResult.Stats.of(3, 1)));

        mockMvc.perform(post("/api/v1/segment/multi")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"a,b\",\"rules\":[\"symbolSplit\",\"removeSymbols\"],\"options\":{\"rules\":[]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appliedRules[0]").value("removeSymbols"))
                .andExpect(jsonPath("$.conflicts[0].rule").value("symbolSplit"))
                .andExpect(jsonPath("$.conflicts[0].action").value("skipped"))
                .andExpect(jsonPath("$.stats.avgLength").value(3));
    }

    @Test
    void rule_cycle_is_unprocessable() throws Exception {
        when(segmentAppService.composeRules(any(), any(), any()))
                .thenThrow(new RuleConfigurationException("Rule dependency cycle: a -> b -> a"));

        mockMvc.perform(post("/api/v1/segment/multi")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"x\",\"rules\":[\"namingSplit\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("RULE_CONFIGURATION_ERROR"));
    }

    @Test
    void unknown_single_rule_is_bad_request() throws Exception {
        when(segmentAppService.applySingleRule(any(), eq("bogus"), any()))
                .thenThrow(new IllegalArgumentException("Unknown rule: bogus"));

        mockMvc.perform(post("/api/v1/segment/rule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tokens\":[\"a\"],\"rule\":\"bogus\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown rule: bogus"));
    }
}
