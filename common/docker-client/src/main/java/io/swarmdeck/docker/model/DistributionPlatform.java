package io.swarmdeck.docker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Platform entry of a registry manifest (OCI image-spec field names).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistributionPlatform(@JsonProperty("architecture") String architecture,
                                   @JsonProperty("os") String os,
                                   @JsonProperty("os.version") String osVersion,
                                   @JsonProperty("os.features") List<String> osFeatures,
                                   @JsonProperty("variant") String variant,
                                   @JsonProperty("features") List<String> features) {

    public static DistributionPlatform of(String architecture, String os) {
        return new DistributionPlatform(architecture, os, null, null, null, null);
    }
}
