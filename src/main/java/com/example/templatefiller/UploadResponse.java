package com.example.templatefiller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
    private boolean success;
    @JsonProperty("output_key")
    private String outputKey;
    @JsonProperty("output_url")
    private String outputUrl;
    @JsonProperty("unresolved_placeholders")
    private List<String> unresolvedPlaceholders;
}
