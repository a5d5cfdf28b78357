package com.example.templatefiller;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlaceholdersResponse {
    @JsonProperty("template_key")
    private String templateKey;
    private List<String> placeholders;
}
