package com.fenci.domain.segment.model;

/**
 * A link detected in the input text before it is handed to the language model.
 *
 * @param index        0-based placeholder counter
 * @param originalText the exact text found in the input
 * @param url          the full URL (equal to originalText for literal links)
 * @param placeholder  e.g. "{{LINK_0}}"
 * @param type         literal URL or completed bare domain
 * @param startPos     start position in the input
 * @param endPos       end position (exclusive) in the input
 */
public record LinkSpan(
        int index,
        String originalText,
        String url,
        String placeholder,
        LinkType type,
        int startPos,
        int endPos
) {}
