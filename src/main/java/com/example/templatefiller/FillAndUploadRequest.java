package com.example.templatefiller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FillAndUploadRequest {
    private Map<String, String> placeholders = new HashMap<>();
    private Map<String, String> images = new HashMap<>();
    @JsonProperty("template_key")
    private String templateKey = FillRequest.DEFAULT_TEMPLATE_KEY;
    @JsonProperty("output_key")
    private String outputKey;
}
