package com.fenci.domain.segment.model;

import java.util.List;

/**
 * @param originalLink   canonical https://github.com/owner/repo link
 * @param generatedLinks the original link followed by its documentation mirrors
 */
public record RepositoryLinks(String owner, String repository, String originalLink, List<String> generatedLinks) {

    public RepositoryLinks {
        generatedLinks = List.copyOf(generatedLinks);
    }
}
