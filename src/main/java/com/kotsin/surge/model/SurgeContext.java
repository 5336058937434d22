package com.kotsin.surge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * SurgeContext - Optional caller knowledge used for cause attribution only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurgeContext {

    @Builder.Default
    private List<String> competitors = new ArrayList<>();

    @Builder.Default
    private List<String> recentNews = new ArrayList<>();

    private BusinessProfileType profileType;

    public static SurgeContext none() {
        return new SurgeContext();
    }
}
