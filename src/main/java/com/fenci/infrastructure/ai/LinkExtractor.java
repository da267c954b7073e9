package com.fenci.infrastructure.ai;

import com.fenci.domain.segment.model.LinkSpan;
import com.fenci.domain.segment.model.LinkType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects links that must survive the language-model round trip unchanged.
 *
 * Literal URLs carry an explicit scheme and must parse as a URI. Suspect links are bare
 * domains with a well-known suffix; they are completed with the scheme of the nearest
 * preceding literal URL, or the default protocol when none precedes.
 */
@Slf4j
@Component
public class LinkExtractor {

    private static final Pattern LITERAL_URL = Pattern.compile(
            "(?:https?|ftp)://[^\\s<>\"{}|\\\\^`\\[\\]]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern SUSPECT_DOMAIN = Pattern.compile(
            "\\b(?:[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9]?\\.)+"
                    + "(?:com|org|net|cn|io|cc|co|gov|edu|app|dev|info|xyz|top|online|site)\\b",
            Pattern.CASE_INSENSITIVE);

    /** First labels that look like domains but almost never are ("version.io", "figure.co"). */
    private static final Set<String> EXCLUDED_LABELS = Set.of(
            "version", "release", "chapter", "section", "figure", "table",
            "algorithm", "function", "method", "class", "object", "property",
            "copyright", "trademark", "trademarked", "registered");

    private record RawMatch(int start, int end, String text, LinkType type) {}

    /**
     * @return non-overlapping links sorted by position, suspect links already completed
     */
    public List<LinkSpan> extract(String text, String defaultProtocol) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<RawMatch> literals = findLiterals(text);
        List<RawMatch> matches = new ArrayList<>(literals);
        matches.addAll(findSuspects(text, literals));
        matches.sort(Comparator.comparingInt(RawMatch::start));

        List<LinkSpan> spans = new ArrayList<>();
        for (RawMatch m : matches) {
            int index = spans.size();
            String url = m.type == LinkType.LITERAL
                    ? m.text
                    : protocolBefore(m.start, literals, defaultProtocol) + m.text;
            spans.add(new LinkSpan(index, m.text, url, "{{LINK_" + index + "}}", m.type, m.start, m.end));
        }
        log.debug("[LinkExtractor] {} literal, {} suspect links",
                literals.size(), spans.size() - literals.size());
        return spans;
    }

    private List<RawMatch> findLiterals(String text) {
        List<RawMatch> literals = new ArrayList<>();
        Matcher matcher = LITERAL_URL.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group();
            if (isValidUri(candidate)) {
                literals.add(new RawMatch(matcher.start(), matcher.end(), candidate, LinkType.LITERAL));
            }
        }
        return literals;
    }

    private List<RawMatch> findSuspects(String text, List<RawMatch> literals) {
        List<RawMatch> suspects = new ArrayList<>();
        Matcher matcher = SUSPECT_DOMAIN.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            if (overlapsAny(start, end, literals) || (start > 0 && text.charAt(start - 1) == '@')) {
                continue;
            }
            String domain = matcher.group();
            String firstLabel = domain.substring(0, domain.indexOf('.')).toLowerCase(Locale.ROOT);
            if (EXCLUDED_LABELS.contains(firstLabel)) {
                continue;
            }
            suspects.add(new RawMatch(start, end, domain, LinkType.SUSPECT));
        }
        return suspects;
    }

    private static String protocolBefore(int position, List<RawMatch> literals, String defaultProtocol) {
        String protocol = defaultProtocol;
        for (RawMatch literal : literals) {
            if (literal.start >= position) {
                break;
            }
            protocol = literal.text.substring(0, literal.text.indexOf("://") + 3);
        }
        return protocol;
    }

    private static boolean overlapsAny(int start, int end, List<RawMatch> spans) {
        for (RawMatch span : spans) {
            if (start < span.end && end > span.start) {
                return true;
            }
        }
        return false;
    }

    private static boolean isValidUri(String candidate) {
        try {
            URI uri = new URI(candidate);
            return uri.getScheme() != null;
        } catch (URISyntaxException e) {
            log.debug("[LinkExtractor] Skipping malformed URL '{}': {}", candidate, e.getMessage());
            return false;
        }
    }
}
