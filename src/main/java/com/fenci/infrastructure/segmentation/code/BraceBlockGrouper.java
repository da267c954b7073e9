package com.fenci.infrastructure.segmentation.code;

import com.fenci.infrastructure.segmentation.code.BracketSpanExtractor.BracketSplit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups brace-delimited code (C/C++/Java/JS style). Lines accumulate while brace or paren
 * depth is positive; once both return to zero the chunk is split around its largest bracketed
 * span. Preprocessor directives and import lines are always standalone tokens.
 */
@Component
@RequiredArgsConstructor
public class BraceBlockGrouper {

    private final BracketSpanExtractor bracketSpanExtractor;

    public List<String> group(String text) {
        List<String> lines = CodeLines.trimmedLines(text);
        if (lines.isEmpty()) {
            return List.of();
        }

        List<String> blocks = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int braceDepth = 0;
        int parenDepth = 0;

        for (String line : lines) {
            if (CodeLines.isPreprocessorDirective(line) || CodeLines.isImportStatement(line)) {
                flushRaw(chunk, blocks);
                blocks.add(line);
                continue;
            }

            for (int i = 0; i < line.length(); i++) {
                switch (line.charAt(i)) {
                    case '{' -> braceDepth++;
                    case '}' -> braceDepth = Math.max(0, braceDepth - 1);
                    case '(' -> parenDepth++;
                    case ')' -> parenDepth = Math.max(0, parenDepth - 1);
                    default -> {
                        // not a depth symbol
                    }
                }
            }

            if (chunk.length() > 0) {
                chunk.append(' ');
            }
            chunk.append(line);

            if (braceDepth == 0 && parenDepth == 0) {
                emitChunk(chunk.toString(), blocks);
                chunk.setLength(0);
            }
        }

        if (!chunk.toString().isBlank()) {
            emitChunk(chunk.toString(), blocks);
        }

        return blocks.isEmpty() ? lines : blocks;
    }

    private void emitChunk(String chunk, List<String> blocks) {
        String trimmed = chunk.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        Optional<BracketSplit> split = bracketSpanExtractor.extract(trimmed);
        if (split.isPresent() && !split.get().prefix().isEmpty()) {
            blocks.add(split.get().prefix());
            blocks.add(split.get().bracket());
            if (!split.get().suffix().isEmpty()) {
                blocks.add(split.get().suffix());
            }
        } else {
            blocks.add(trimmed);
        }
    }

    private static void flushRaw(StringBuilder chunk, List<String> blocks) {
        String content = chunk.toString().strip();
        if (!content.isEmpty()) {
            blocks.add(content);
        }
        chunk.setLength(0);
    }
}
