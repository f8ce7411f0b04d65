package io.cronhttp.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code job.data} of an HTTP job.
 *
 * @param url            target URL
 * @param verb           HTTP method
 * @param numberOfClones how many concurrent requests one run fires; values below 1 mean 1
 * @param enableShadows  if true a run is closed out without waiting for its requests
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpJobPayload(
        @JsonProperty("url") String url,
        @JsonProperty("verb") String verb,
        @JsonProperty("number_of_clones") int numberOfClones,
        @JsonProperty("enable_shadows") boolean enableShadows
) {

    public int clones() {
        return Math.max(numberOfClones, 1);
    }
}
