package com.fenci.interfaces.api.dictionary;

import com.fenci.application.segment.SegmentAppService;
import com.fenci.domain.segment.model.ChineseDictionary;
import com.fenci.infrastructure.segmentation.chinese.DictionaryStore.WordUpdate;
import com.fenci.interfaces.api.dto.ContainsWordRequest;
import com.fenci.interfaces.api.dto.ContainsWordResponse;
import com.fenci.interfaces.api.dto.DictionaryResponse;
import com.fenci.interfaces.api.dto.DictionaryUpdateRequest;
import com.fenci.interfaces.api.dto.DictionaryWordsRequest;
import com.fenci.interfaces.api.dto.KeywordRequest;
import com.fenci.interfaces.api.dto.KeywordResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/dictionary")
@RequiredArgsConstructor
public class DictionaryController {

    private final SegmentAppService segmentAppService;

    @GetMapping
    public ResponseEntity<DictionaryResponse> current() {
        return ResponseEntity.ok(DictionaryResponse.from(segmentAppService.currentDictionary()));
    }

    @PutMapping
    public ResponseEntity<DictionaryResponse> replace(@RequestBody DictionaryUpdateRequest request) {
        ChineseDictionary dictionary = segmentAppService.replaceDictionary(request.toDocument());
        return ResponseEntity.ok(DictionaryResponse.from(dictionary));
    }

    @PostMapping("/words")
    public ResponseEntity<DictionaryResponse> addWords(@Valid @RequestBody DictionaryWordsRequest request) {
        WordUpdate update = segmentAppService.addWords(request.words());
        return ResponseEntity.ok(DictionaryResponse.from(update.dictionary(), update.added(), update.ignored()));
    }

    @PostMapping("/keywords")
    public ResponseEntity<KeywordResponse> keywords(@Valid @RequestBody KeywordRequest request) {
        return ResponseEntity.ok(new KeywordResponse(
                segmentAppService.extractKeywords(request.text(), request.topKOrDefault()).stream()
                        .map(k -> new KeywordResponse.Keyword(k.word(), k.weight()))
                        .toList()));
    }

    @PostMapping("/contains")
    public ResponseEntity<ContainsWordResponse> contains(@Valid @RequestBody ContainsWordRequest request) {
        return ResponseEntity.ok(new ContainsWordResponse(
                segmentAppService.containsDictionaryWord(request.text())));
    }
}
