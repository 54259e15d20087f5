package com.cellar.readiness.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Shape of the AI profile stored in the wine_profile column and returned by the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WineProfilePayload {

    private Integer body;
    private Integer tannin;
    private Integer acidity;
    private Integer oak;
    private Integer sweetness;

    @JsonProperty("alcohol_est")
    private Double alcoholEst;

    /**
     * Always recomputed server-side from the axes, never trusted from the model
     */
    private Integer power;

    @JsonProperty("style_tags")
    private List<String> styleTags;

    private String confidence; // low, med, high
    private String source;     // ai

    @JsonProperty("updated_at")
    private String updatedAt;

    public boolean hasAllAxes() {
        return body != null && tannin != null && acidity != null && oak != null && sweetness != null;
    }
}
