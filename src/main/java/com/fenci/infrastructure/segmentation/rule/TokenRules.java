package com.fenci.infrastructure.segmentation.rule;

import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentOptions;
import com.fenci.infrastructure.segmentation.NamingSplitter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The individual split and remove transforms. Each one maps every element of the input
 * independently; the caller flattens and drops empty strings.
 */
@Component
@RequiredArgsConstructor
public class TokenRules {

    static final Pattern SYMBOL = Pattern.compile("[^\\w\\s\\u4e00-\\u9fff]");

    private static final String OPENERS = "([{<\"'`«";
    private static final String QUOTES = "\"'`";
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");
    private static final Pattern SCRIPT_RUN = Pattern.compile("[a-zA-Z]+|[\\u4e00-\\u9fff]+");
    private static final Pattern BEFORE_UPPERCASE = Pattern.compile("(?=[A-Z])");
    private static final Pattern DIGIT_RUN = Pattern.compile("[0-9]+");
    private static final Pattern CHINESE = Pattern.compile("[\\u4e00-\\u9fff]+");
    private static final Pattern ENGLISH = Pattern.compile("[a-zA-Z]+");

    private final NamingSplitter namingSplitter;

    public List<String> apply(RuleId rule, List<String> tokens, SegmentOptions options) {
        List<String> out = new ArrayList<>();
        for (String token : tokens) {
            if (token == null || token.isEmpty()) {
                continue;
            }
            out.addAll(switch (rule) {
                case SYMBOL_SPLIT -> symbolSplit(token);
                case WHITESPACE_SPLIT -> splitKeeping(token, WHITESPACE_RUN);
                case NEWLINE_SPLIT -> splitKeeping(token, LINE_BREAK);
                case CHINESE_ENGLISH_SPLIT -> splitKeeping(token, SCRIPT_RUN);
                case UPPERCASE_SPLIT -> List.of(BEFORE_UPPERCASE.split(token));
                case NAMING_SPLIT -> namingSplitter.split(token, options.isNamingRemoveSymbols());
                case DIGIT_SPLIT -> splitKeeping(token, DIGIT_RUN);
                case REMOVE_WHITESPACE -> List.of(WHITESPACE_RUN.matcher(token).replaceAll(""));
                case REMOVE_SYMBOLS -> List.of(SYMBOL.matcher(token).replaceAll(""));
                case REMOVE_CHINESE -> List.of(CHINESE.matcher(token).replaceAll(""));
                case REMOVE_ENGLISH -> List.of(ENGLISH.matcher(token).replaceAll(""));
                case REMOVE_DIGITS -> List.of(DIGIT_RUN.matcher(token).replaceAll(""));
            });
        }
        out.removeIf(String::isEmpty);
        return out;
    }

    static boolean containsSymbol(String token) {
        return SYMBOL.matcher(token).find();
    }

    /**
     * Every opening symbol ({@code ( [ { < " ' ` «}) is a token of its own, nested openers included.
     * Any other symbol run stays on the end of the preceding word. Quotes pair up: a quote that
     * closes an open quote of the same kind is a closing symbol, not an opener.
     */
    private static List<String> symbolSplit(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        Set<Character> openQuotes = new HashSet<>();
        boolean endsWithSymbol = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean closingQuote = QUOTES.indexOf(c) >= 0 && openQuotes.remove(c);
            if (!closingQuote && OPENERS.indexOf(c) >= 0) {
                if (QUOTES.indexOf(c) >= 0) {
                    openQuotes.add(c);
                }
                flush(buffer, parts);
                parts.add(String.valueOf(c));
                endsWithSymbol = false;
                continue;
            }

            boolean symbol = SYMBOL.matcher(String.valueOf(c)).matches();
            if (endsWithSymbol && !symbol) {
                flush(buffer, parts);
            }
            buffer.append(c);
            endsWithSymbol = symbol;
        }
        flush(buffer, parts);
        return parts;
    }

    private static List<String> splitKeeping(String text, Pattern delimiter) {
        List<String> parts = new ArrayList<>();
        Matcher matcher = delimiter.matcher(text);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                parts.add(text.substring(last, matcher.start()));
            }
            parts.add(matcher.group());
            last = matcher.end();
        }
        if (last < text.length()) {
            parts.add(text.substring(last));
        }
        return parts;
    }

    private static void flush(StringBuilder buffer, List<String> parts) {
        if (buffer.length() > 0) {
            parts.add(buffer.toString());
            buffer.setLength(0);
        }
    }
}
