package io.swarmdeck.docker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceCreateResponse(@JsonProperty("ID") String id,
                                    @JsonProperty("Warnings") List<String> warnings) {

    public ServiceCreateResponse {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ServiceCreateResponse empty() {
        return new ServiceCreateResponse(null, List.of());
    }

    public ServiceCreateResponse withWarning(String warning) {
        List<String> merged = new ArrayList<>(warnings);
        merged.add(warning);
        return new ServiceCreateResponse(id, merged);
    }
}
