package com.fenci.interfaces.api.segment;

import com.fenci.application.segment.SegmentAppService;
import com.fenci.application.segment.SegmentResult;
import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.SegmentOverrides;
import com.fenci.domain.segment.model.SingleRuleResult;
import com.fenci.interfaces.api.dto.ModeInfoResponse;
import com.fenci.interfaces.api.dto.MultiRuleRequest;
import com.fenci.interfaces.api.dto.MultiRuleResponse;
import com.fenci.interfaces.api.dto.RuleInfoResponse;
import com.fenci.interfaces.api.dto.SegmentOptionsRequest;
import com.fenci.interfaces.api.dto.SegmentRequest;
import com.fenci.interfaces.api.dto.SegmentResponse;
import com.fenci.interfaces.api.dto.SingleRuleRequest;
import com.fenci.interfaces.api.dto.SingleRuleResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/segment")
@RequiredArgsConstructor
public class SegmentController {

    private final SegmentAppService segmentAppService;

    @PostMapping
    public ResponseEntity<SegmentResponse> segment(@Valid @RequestBody SegmentRequest request) {
        SegmentResult result = segmentAppService.segment(
                request.text(), request.mode(), toOverrides(request.options()));
        return ResponseEntity.ok(new SegmentResponse(result.mode().id(), result.tokens()));
    }

    @PostMapping("/multi")
    public ResponseEntity<MultiRuleResponse> multi(@Valid @RequestBody MultiRuleRequest request) {
        MultiRuleResult result = segmentAppService.composeRules(
                request.text(), request.rules(), toOverrides(request.options()));
        return ResponseEntity.ok(MultiRuleResponse.from(result));
    }

    @PostMapping("/rule")
    public ResponseEntity<SingleRuleResponse> applyRule(@Valid @RequestBody SingleRuleRequest request) {
        SingleRuleResult result = segmentAppService.applySingleRule(
                request.tokens(), request.rule(), toOverrides(request.options()));
        return ResponseEntity.ok(new SingleRuleResponse(
                result.tokens(), result.hasConflict(), result.conflictMessage()));
    }

    @GetMapping("/modes")
    public ResponseEntity<List<ModeInfoResponse>> modes() {
        return ResponseEntity.ok(segmentAppService.modes().stream()
                .map(ModeInfoResponse::from)
                .toList());
    }

    @GetMapping("/rules")
    public ResponseEntity<List<RuleInfoResponse>> rules() {
        return ResponseEntity.ok(segmentAppService.rules().stream()
                .map(RuleInfoResponse::from)
                .toList());
    }

    private SegmentOverrides toOverrides(SegmentOptionsRequest options) {
        if (options == null) {
            return SegmentOverrides.none();
        }
        return options.toOverrides(segmentAppService.resolveRules(options.rules()));
    }
}
