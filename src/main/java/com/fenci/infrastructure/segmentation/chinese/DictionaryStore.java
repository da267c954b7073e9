package com.fenci.infrastructure.segmentation.chinese;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fenci.domain.segment.model.ChineseDictionary;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current dictionary snapshot.
 *
 * Readers take one snapshot per call. Replacement and word additions publish a complete
 * new snapshot through a single reference swap, so a reader sees either the old or the new
 * dictionary, never a mix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DictionaryStore {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private final AtomicReference<ChineseDictionary> current = new AtomicReference<>(ChineseDictionary.empty());

    @Value("${segmenter.dictionary.location:classpath:dictionary/default-dictionary.json}")
    private String location;

    @PostConstruct
    void load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DictionaryLoadException("Dictionary resource not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            DictionaryDocument document = objectMapper.readValue(in, DictionaryDocument.class);
            ChineseDictionary dictionary = document.toDictionary();
            current.set(dictionary);
            log.info("[DictionaryStore] Loaded {} words ({} stop words) from {}",
                    dictionary.size(), dictionary.stopWords().size(), location);
        } catch (IOException e) {
            throw new DictionaryLoadException("Failed to read dictionary resource: " + location, e);
        }
    }

    public ChineseDictionary snapshot() {
        return current.get();
    }

    /**
     * Replace the whole dictionary.
     */
    public ChineseDictionary replace(DictionaryDocument document) {
        if (document == null || document.isEmpty()) {
            throw new DictionaryLoadException("Replacement dictionary must contain at least one word");
        }
        ChineseDictionary replacement = document.toDictionary();
        current.set(replacement);
        log.info("[DictionaryStore] Dictionary replaced: {} words, {} stop words",
                replacement.size(), replacement.stopWords().size());
        return replacement;
    }

    /**
     * Add custom words. Words outside the 2..4 character range are ignored.
     */
    public WordUpdate addWords(Collection<String> words) {
        List<String> accepted = new ArrayList<>();
        List<String> ignored = new ArrayList<>();
        for (String word : words) {
            String trimmed = word == null ? "" : word.strip();
            if (trimmed.length() >= ChineseDictionary.MIN_WORD_LENGTH
                    && trimmed.length() <= ChineseDictionary.MAX_WORD_LENGTH) {
                accepted.add(trimmed);
            } else {
                ignored.add(word);
            }
        }
        if (!ignored.isEmpty()) {
            log.warn("[DictionaryStore] Ignored {} words outside 2..4 characters: {}", ignored.size(), ignored);
        }

        ChineseDictionary updated = current.updateAndGet(dictionary -> dictionary.withWords(accepted));
        log.info("[DictionaryStore] Added {} custom words, dictionary now holds {}", accepted.size(), updated.size());
        return new WordUpdate(accepted, ignored, updated);
    }

    /**
     * @param added          words filed into the dictionary
     * @param ignored        words rejected for their length
     * @param dictionary     the snapshot published by this update
     */
    public record WordUpdate(List<String> added, List<String> ignored, ChineseDictionary dictionary) {}
}
