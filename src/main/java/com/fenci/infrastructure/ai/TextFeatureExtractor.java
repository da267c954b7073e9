package com.fenci.infrastructure.ai;

import com.fenci.domain.segment.model.ContentProfile;
import com.fenci.domain.segment.model.ContentType;
import com.fenci.domain.segment.model.FeatureKind;
import com.fenci.domain.segment.model.RepositoryLinks;
import com.fenci.domain.segment.model.TextFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured data out of free text: links, e-mail addresses, phone numbers,
 * IPv4 addresses, file paths, GitHub repositories and dates.
 *
 * Every extractor returns distinct matches in first-occurrence order.
 */
@Slf4j
@Component
public class TextFeatureExtractor {

    private static final Pattern URL = Pattern.compile(
            "https?://[^\\s<>\"{}|\\\\^`\\[\\]]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern EMAIL = Pattern.compile(
            "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}", Pattern.CASE_INSENSITIVE);

    /** Mainland mobile numbers and landlines with area code, optional +86 prefix. */
    private static final Pattern PHONE = Pattern.compile(
            "(?:\\+86[-\\s]?)?(?:1[3-9]\\d{9}|0\\d{2,3}[-\\s]?\\d{7,8})");

    private static final Pattern IPV4 = Pattern.compile(
            "(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)");

    private static final Pattern DATE = Pattern.compile("\\d{4}[-/年]\\d{1,2}[-/月]\\d{1,2}");

    /**
     * Quoted paths first so that spaces inside quotes survive.
     * The drive letter must not follow another letter, so "https://" is no path.
     */
    private static final List<Pattern> PATHS = List.of(
            Pattern.compile("\"[^\"]*:[\\\\/][^\"]*\""),
            Pattern.compile("'[^']*:[\\\\/][^']*'"),
            Pattern.compile("(?<![a-zA-Z])[a-zA-Z]:[\\\\/][^\\s<>\"|?*]+"),
            Pattern.compile("/[\\\\/]?(?:home|Users|usr)[\\\\/][^\\s<>\"|?*]+"));

    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"']|[\"']$");

    private static final Pattern GITHUB_REPO = Pattern.compile(
            "github\\.com[/:]([\\w-]+)/([\\w.-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OWNER_REPO = Pattern.compile("^([\\w-]+)/([\\w.-]+)$");

    private static final List<String> MIRROR_HOSTS = List.of(
            "https://github.com/", "https://zread.ai/", "https://deepwiki.com/", "https://context7.com/");

    private static final Pattern SCHEME = Pattern.compile("https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern PATH_HINT = Pattern.compile(
            "(?<![a-zA-Z])[a-zA-Z]:[\\\\/]|/(?:home|Users|usr)[\\\\/]", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPO_HINT = Pattern.compile("[\\w-]+/[\\w-]+");
    private static final Pattern HAN = Pattern.compile("[\\u4e00-\\u9fa5]");
    private static final Pattern LATIN_WORD = Pattern.compile("[a-zA-Z]+");

    public List<String> extractUrls(String text) {
        return distinctMatches(URL, text);
    }

    public List<String> extractEmails(String text) {
        return distinctMatches(EMAIL, text);
    }

    public List<String> extractPhoneNumbers(String text) {
        return distinctMatches(PHONE, text);
    }

    public List<String> extractIpAddresses(String text) {
        return distinctMatches(IPV4, text);
    }

    public List<String> extractDates(String text) {
        return distinctMatches(DATE, text);
    }

    /**
     * Windows drive paths, Unix home paths and quoted paths, with surrounding quotes removed.
     */
    public List<String> extractPaths(String text) {
        if (isBlank(text)) {
            return List.of();
        }
        Set<String> paths = new LinkedHashSet<>();
        for (Pattern pattern : PATHS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                paths.add(SURROUNDING_QUOTES.matcher(matcher.group()).replaceAll(""));
            }
        }
        return List.copyOf(paths);
    }

    /**
     * Resolve a GitHub URL or a bare {@code owner/repo} string to the repository page and its mirrors.
     * A GitHub URL anywhere in the input wins; the bare form must be the whole input.
     */
    public Optional<RepositoryLinks> generateRepositoryLinks(String input) {
        if (isBlank(input)) {
            return Optional.empty();
        }
        String owner;
        String repository;
        Matcher github = GITHUB_REPO.matcher(input);
        Matcher bare = OWNER_REPO.matcher(input.trim());
        if (github.find()) {
            owner = github.group(1);
            repository = github.group(2).replaceFirst("\\.git$", "");
        } else if (bare.matches()) {
            owner = bare.group(1);
            repository = bare.group(2);
        } else {
            return Optional.empty();
        }
        if (repository.isEmpty()) {
            return Optional.empty();
        }

        String suffix = owner + "/" + repository;
        List<String> links = MIRROR_HOSTS.stream().map(host -> host + suffix).toList();
        return Optional.of(new RepositoryLinks(owner, repository, links.get(0), links));
    }

    /**
     * Every feature found in the text, in {@link FeatureKind} order. Kinds with no match are left out.
     */
    public List<TextFeature> analyze(String text) {
        if (isBlank(text)) {
            return List.of();
        }
        List<TextFeature> features = new ArrayList<>();
        addIfPresent(features, FeatureKind.URL, extractUrls(text));
        addIfPresent(features, FeatureKind.EMAIL, extractEmails(text));
        addIfPresent(features, FeatureKind.PHONE, extractPhoneNumbers(text));
        addIfPresent(features, FeatureKind.IP_ADDRESS, extractIpAddresses(text));
        addIfPresent(features, FeatureKind.PATH, extractPaths(text));
        if (GITHUB_REPO.matcher(text).find()) {
            generateRepositoryLinks(text)
                    .ifPresent(links -> features.add(new TextFeature(FeatureKind.GITHUB, links.generatedLinks())));
        }
        addIfPresent(features, FeatureKind.DATE, extractDates(text));

        log.debug("[TextFeatureExtractor] {} feature kinds in {} chars", features.size(), text.length());
        return features;
    }

    /**
     * Classify the text. Structural hints are checked first (URL, e-mail, repository, path);
     * otherwise the larger script ratio above one half decides.
     */
    public ContentProfile detectContentType(String text) {
        if (isBlank(text)) {
            return ContentProfile.empty();
        }
        boolean hasUrl = SCHEME.matcher(text).find();
        boolean hasEmail = EMAIL.matcher(text).find();
        boolean hasPath = PATH_HINT.matcher(text).find();
        boolean hasRepo = REPO_HINT.matcher(text).find();
        int chineseCount = count(HAN, text);
        int englishCount = count(LATIN_WORD, text);

        double chineseRatio = (double) chineseCount / text.length();
        double englishRatio = (double) englishCount / text.length();

        ContentType type;
        double confidence;
        if (hasUrl && !hasEmail) {
            type = ContentType.URL_COLLECTION;
            confidence = 0.9;
        } else if (hasEmail) {
            type = ContentType.CONTACT_INFO;
            confidence = 0.9;
        } else if (hasRepo) {
            type = ContentType.REPOSITORY;
            confidence = 0.85;
        } else if (hasPath) {
            type = ContentType.FILE_PATH;
            confidence = 0.8;
        } else if (chineseRatio > 0.5) {
            type = ContentType.CHINESE_TEXT;
            confidence = Math.min(0.95, chineseRatio + 0.3);
        } else if (englishRatio > 0.5) {
            type = ContentType.ENGLISH_TEXT;
            confidence = Math.min(0.95, englishRatio + 0.3);
        } else {
            type = ContentType.MIXED_TEXT;
            confidence = 0.5;
        }
        return new ContentProfile(type, confidence, hasUrl, hasEmail, hasPath, hasRepo, chineseCount, englishCount);
    }

    private static void addIfPresent(List<TextFeature> features, FeatureKind kind, List<String> values) {
        if (!values.isEmpty()) {
            features.add(new TextFeature(kind, values));
        }
    }

    private static List<String> distinctMatches(Pattern pattern, String text) {
        if (isBlank(text)) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return List.copyOf(found);
    }

    private static int count(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
