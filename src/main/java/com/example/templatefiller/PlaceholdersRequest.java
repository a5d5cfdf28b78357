package com.example.templatefiller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceholdersRequest {
    @JsonProperty("template_key")
    private String templateKey = FillRequest.DEFAULT_TEMPLATE_KEY;
}
