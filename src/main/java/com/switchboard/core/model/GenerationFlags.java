package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Explicit capability toggles a client can attach to a request.
 * Any flag set forces the agent path.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationFlags(
    @JsonProperty("generate_image") boolean generateImage,
    @JsonProperty("generate_video") boolean generateVideo,
    @JsonProperty("generate_audio") boolean generateAudio,
    @JsonProperty("deep_research") boolean deepResearch,
    @JsonProperty("web_search") boolean webSearch
) {

    public static final GenerationFlags NONE = new GenerationFlags(false, false, false, false, false);

    /**
     * Human readable reasons for every flag that is set, in declaration order.
     */
    public List<String> reasons() {
        var reasons = new ArrayList<String>();
        if (generateImage) reasons.add("image generation requested");
        if (generateVideo) reasons.add("video generation requested");
        if (generateAudio) reasons.add("audio generation requested");
        if (deepResearch) reasons.add("deep research requested");
        if (webSearch) reasons.add("web search requested");
        return reasons;
    }
}
