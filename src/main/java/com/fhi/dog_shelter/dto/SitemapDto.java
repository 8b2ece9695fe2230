package com.fhi.dog_shelter.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the client needs to render sitemap.xml: one page per dog id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SitemapDto {

    @JsonProperty("dog_ids")
    private List<Long> dogIds;

    @JsonProperty("last_updated")
    private Instant lastUpdated;
}
