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
public class FillRequest {
    public static final String DEFAULT_TEMPLATE_KEY = "_Templates/IDS_Template_Fairbridge.docx";
    public static final String DEFAULT_OUTPUT_FILENAME = "IDS_Generated.docx";

    private Map<String, String> placeholders = new HashMap<>();
    /** Placeholder name to base64 image data. */
    private Map<String, String> images = new HashMap<>();
    @JsonProperty("template_key")
    private String templateKey = DEFAULT_TEMPLATE_KEY;
    @JsonProperty("output_filename")
    private String outputFilename = DEFAULT_OUTPUT_FILENAME;
}
