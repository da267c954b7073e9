package com.fenci.infrastructure.segmentation.code;

import com.fenci.domain.segment.model.CodeDialect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Code mode. Detects the dialect and delegates to the matching block grouper.
 * Malformed code never fails; anything unrecognised is analysed line by line.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeAnalyzer {

    private final IndentBlockGrouper indentBlockGrouper;
    private final BraceBlockGrouper braceBlockGrouper;

    public List<String> analyze(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        CodeDialect dialect = detectDialect(text);
        List<String> tokens = switch (dialect) {
            case BRACE_DELIMITED -> braceBlockGrouper.group(text);
            case INDENTATION_DELIMITED -> indentBlockGrouper.group(text);
            case LINE_BASED -> CodeLines.trimmedLines(text);
        };

        log.debug("[CodeAnalyzer] dialect={}, blocks={}", dialect.label(), tokens.size());
        return tokens;
    }

    public CodeDialect detectDialect(String text) {
        List<String> lines = CodeLines.trimmedLines(text);
        if (lines.stream().anyMatch(line -> line.indexOf('{') >= 0 || line.indexOf('}') >= 0)) {
            return CodeDialect.BRACE_DELIMITED;
        }
        if (lines.stream().anyMatch(CodeLines::isBlockHeader)) {
            return CodeDialect.INDENTATION_DELIMITED;
        }
        return CodeDialect.LINE_BASED;
    }
}
