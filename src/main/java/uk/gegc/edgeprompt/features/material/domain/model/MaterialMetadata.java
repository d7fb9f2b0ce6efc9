package uk.gegc.edgeprompt.features.material.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.edgeprompt.features.ai.domain.ContentTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied and generated attributes of a material, stored as JSON in {@code materials.metadata}.
 * Keys without a dedicated field are kept in {@link #additionalAttributes()} and written back unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MaterialMetadata {

    private String title;
    private String subject;
    private String grade;
    private String chapter;
    private String focusArea;
    private Boolean useSourceLanguage;

    @Builder.Default
    private List<String> learningObjectives = new ArrayList<>();

    @Builder.Default
    private List<ContentTemplate> templates = new ArrayList<>();

    private Integer wordCount;
    private Instant processedAt;

    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> additionalAttributes() {
        return additional;
    }

    @JsonAnySetter
    public void putAdditionalAttribute(String key, Object value) {
        additional.put(key, value);
    }

    public MaterialMetadata copy() {
        return toBuilder()
                .learningObjectives(new ArrayList<>(learningObjectives == null ? List.of() : learningObjectives))
                .templates(new ArrayList<>(templates == null ? List.of() : templates))
                .additional(new LinkedHashMap<>(additional))
                .build();
    }
}
