package me.internalizable.modmanager.registry.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Envelope of the search endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResponse(
        List<SearchHit> hits,
        int offset,
        int limit,
        @JsonProperty("total_hits") int totalHits
) {

    public SearchResponse {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }
}
