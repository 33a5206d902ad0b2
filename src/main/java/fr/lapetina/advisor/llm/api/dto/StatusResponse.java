package fr.lapetina.advisor.llm.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.advisor.llm.domain.model.StatusSnapshot;

/**
 * JSON view of a {@link StatusSnapshot}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        String phase,
        boolean available,
        boolean loading,
        @JsonProperty("current_model") String currentModel,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("last_progress") String lastProgress,
        String device,
        @JsonProperty("device_memory_used_bytes") long deviceMemoryUsedBytes,
        @JsonProperty("device_memory_total_bytes") long deviceMemoryTotalBytes,
        @JsonProperty("device_memory_used_gb") double deviceMemoryUsedGb,
        @JsonProperty("device_memory_total_gb") double deviceMemoryTotalGb
) {
    public static StatusResponse from(StatusSnapshot snapshot) {
        return new StatusResponse(
                snapshot.state().phase().name(),
                snapshot.available(),
                snapshot.loading(),
                snapshot.currentModel() != null ? snapshot.currentModel().value() : null,
                snapshot.lastError(),
                snapshot.lastProgress(),
                snapshot.device(),
                snapshot.deviceMemoryUsedBytes(),
                snapshot.deviceMemoryTotalBytes(),
                snapshot.deviceMemoryUsedGb(),
                snapshot.deviceMemoryTotalGb()
        );
    }
}
