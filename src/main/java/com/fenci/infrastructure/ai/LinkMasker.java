package com.fenci.infrastructure.ai;

import com.fenci.domain.segment.model.LinkSpan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Replaces detected links with {@code {{LINK_n}}} placeholders before the text is sent to
 * the language model, and recognises placeholders echoed back in its output.
 */
@Component
public class LinkMasker {

    // Tolerates minor model variations: {{LINK_1}}, {{ LINK_1 }}, {{LINK-1}}
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*LINK[-_]\\d+\\s*\\}\\}");

    /**
     * @param spans links sorted by start position, non-overlapping
     */
    public String mask(String text, List<LinkSpan> spans) {
        if (spans == null || spans.isEmpty()) {
            return text;
        }

        StringBuilder sb = new StringBuilder();
        int lastEnd = 0;
        for (LinkSpan span : spans) {
            sb.append(text, lastEnd, span.startPos());
            sb.append(span.placeholder());
            lastEnd = span.endPos();
        }
        sb.append(text, lastEnd, text.length());
        return sb.toString();
    }

    /**
     * True for a model token that is exactly one link placeholder, surrounding whitespace aside.
     */
    public boolean isPlaceholder(String token) {
        return token != null && PLACEHOLDER.matcher(token.strip()).matches();
    }

    /**
     * Remove placeholders the model glued onto other text, e.g. {@code 见{{LINK_0}}} becomes {@code 见}.
     */
    public String stripPlaceholders(String token) {
        if (token == null) {
            return "";
        }
        return PLACEHOLDER.matcher(token).replaceAll("");
    }
}
