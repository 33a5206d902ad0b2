package fr.lapetina.advisor.llm.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /models/load}: a catalog display name or a model id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadRequestDto {

    private String model;

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
}
