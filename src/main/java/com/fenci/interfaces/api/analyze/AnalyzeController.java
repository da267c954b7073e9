package com.fenci.interfaces.api.analyze;

import com.fenci.application.analyze.TextAnalysisAppService;
import com.fenci.interfaces.api.dto.AnalyzeRequest;
import com.fenci.interfaces.api.dto.AnalyzeResponse;
import com.fenci.interfaces.api.dto.RepositoryLinksResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analyze")
@RequiredArgsConstructor
public class AnalyzeController {

    private final TextAnalysisAppService textAnalysisAppService;

    @PostMapping
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return ResponseEntity.ok(AnalyzeResponse.from(textAnalysisAppService.analyze(request.text())));
    }

    /**
     * 404 when the input is neither a GitHub URL nor an {@code owner/repo} pair.
     */
    @PostMapping("/repository")
    public ResponseEntity<RepositoryLinksResponse> repository(@Valid @RequestBody AnalyzeRequest request) {
        return textAnalysisAppService.repositoryLinks(request.text())
                .map(RepositoryLinksResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
