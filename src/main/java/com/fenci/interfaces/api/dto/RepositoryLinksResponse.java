package com.fenci.interfaces.api.dto;

import com.fenci.domain.segment.model.RepositoryLinks;

import java.util.List;

public record RepositoryLinksResponse(String owner, String repository, String originalLink, List<String> generatedLinks) {

    public static RepositoryLinksResponse from(RepositoryLinks links) {
        return new RepositoryLinksResponse(
                links.owner(), links.repository(), links.originalLink(), links.generatedLinks());
    }
}
