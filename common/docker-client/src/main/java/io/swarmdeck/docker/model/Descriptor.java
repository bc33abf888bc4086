package io.swarmdeck.docker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OCI content descriptor returned by a registry for a manifest.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Descriptor(@JsonProperty("mediaType") String mediaType,
                         @JsonProperty("digest") String digest,
                         @JsonProperty("size") Long size,
                         @JsonProperty("urls") List<String> urls) {

    public static Descriptor ofDigest(String digest) {
        return new Descriptor(null, digest, null, null);
    }
}
