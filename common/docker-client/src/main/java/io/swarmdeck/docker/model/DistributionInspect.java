package io.swarmdeck.docker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of {@code GET /distribution/{name}/json}: the manifest descriptor of an image and the
 * platforms it can run on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistributionInspect(@JsonProperty("Descriptor") Descriptor descriptor,
                                  @JsonProperty("Platforms") List<DistributionPlatform> platforms) {

    public DistributionInspect {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public String digest() {
        return descriptor == null ? null : descriptor.digest();
    }
}
