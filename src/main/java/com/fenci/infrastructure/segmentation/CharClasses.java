package com.fenci.infrastructure.segmentation;

/**
 * Character classification shared by all segmenters. All methods take code points.
 */
public final class CharClasses {

    /** Punctuation emitted as standalone tokens in smart mode. */
    private static final String PUNCTUATION =
            "，。！？；：“”‘’（）【】《》<>「」『』,.!?;:'\"()[]{}–—-";

    /** Full-width punctuation treated as a separator in chinese mode. */
    private static final String CHINESE_PUNCTUATION = "，。！？；：“”‘’（）【】《》「」『』";

    /** Symbols treated as word separators in english mode and stripped in removeSymbols mode. */
    private static final String SYMBOLS = ",.!?;:'\"()[]{}–—-";

    /** Separators a soft line break may follow in charBreak mode. */
    private static final String BREAK_PUNCTUATION =
            "，。！？；：“”‘’（）【】《》<>「」『』,!?;:'\"()[]{}–—-";

    /** Sentence terminators (newline handled separately). */
    private static final String SENTENCE_TERMINATORS = "。！？!?";

    private CharClasses() {
    }

    public static boolean isCjk(int cp) {
        return cp >= 0x4E00 && cp <= 0x9FFF;
    }

    public static boolean isAsciiLetter(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z');
    }

    public static boolean isUpper(int cp) {
        return cp >= 'A' && cp <= 'Z';
    }

    public static boolean isLower(int cp) {
        return cp >= 'a' && cp <= 'z';
    }

    public static boolean isDigit(int cp) {
        return cp >= '0' && cp <= '9';
    }

    public static boolean isWhitespace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp);
    }

    public static boolean isPunctuation(int cp) {
        return PUNCTUATION.indexOf(cp) >= 0;
    }

    public static boolean isChinesePunctuation(int cp) {
        return CHINESE_PUNCTUATION.indexOf(cp) >= 0;
    }

    public static boolean isSymbol(int cp) {
        return SYMBOLS.indexOf(cp) >= 0;
    }

    public static boolean isBreakSeparator(int cp) {
        return isWhitespace(cp) || BREAK_PUNCTUATION.indexOf(cp) >= 0;
    }

    public static boolean isSentenceTerminator(int cp) {
        return cp == '\n' || SENTENCE_TERMINATORS.indexOf(cp) >= 0;
    }

    public static boolean isBlank(String text) {
        return text == null || text.codePoints().allMatch(CharClasses::isWhitespace);
    }

    public static boolean allAsciiDigits(String text) {
        return !text.isEmpty() && text.chars().allMatch(CharClasses::isDigit);
    }
}
