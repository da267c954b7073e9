package com.fenci.infrastructure.segmentation.code;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level helpers shared by the block groupers.
 */
final class CodeLines {

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");

    private static final Pattern PREPROCESSOR =
            Pattern.compile("^\\s*#\\s*(define|include|ifdef|ifndef|endif|else|if|pragma)\\b");

    private static final Pattern IMPORT =
            Pattern.compile("^\\s*(import|from|require|using|include)\\s+[\\w.]+");

    private CodeLines() {
    }

    /** Non-blank lines with trailing whitespace removed; leading indentation is kept. */
    static List<String> nonBlankLines(String text) {
        return Arrays.stream(LINE_BREAKS.split(text))
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .toList();
    }

    static List<String> trimmedLines(String text) {
        return Arrays.stream(LINE_BREAKS.split(text))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    static boolean isBlockHeader(String trimmedLine) {
        return trimmedLine.endsWith(":") && !trimmedLine.endsWith("::");
    }

    static boolean isPreprocessorDirective(String line) {
        return PREPROCESSOR.matcher(line).find();
    }

    static boolean isImportStatement(String line) {
        return IMPORT.matcher(line).find();
    }
}
