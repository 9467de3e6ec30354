package com.autoagent.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;

/**
 * Response of an OpenAI-compatible {@code /models} call.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelListResponse {
    private List<Model> data;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Model {
        private String id;
    }
}
