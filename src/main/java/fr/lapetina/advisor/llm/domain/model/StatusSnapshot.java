package fr.lapetina.advisor.llm.domain.model;

/**
 * Read-only copy of the lifecycle status. Safe to hand to any thread.
 *
 * @param state                  lifecycle state at the time of the snapshot
 * @param loading                whether a load is currently running
 * @param lastProgress           last milestone reported by a load, may be empty
 * @param device                 compute device name, {@code "none"} without accelerator
 * @param deviceMemoryUsedBytes  bytes in use on the device, 0 when unknown
 * @param deviceMemoryTotalBytes device capacity in bytes, 0 when unknown
 */
public record StatusSnapshot(
        LifecycleState state,
        boolean loading,
        String lastProgress,
        String device,
        long deviceMemoryUsedBytes,
        long deviceMemoryTotalBytes
) {
    public boolean available() {
        return state.isReady();
    }

    /**
     * Model currently installed, or being loaded, or whose load failed.
     */
    public ModelId currentModel() {
        return state.model();
    }

    public String lastError() {
        return state.phase() == LifecycleState.Phase.FAILED ? state.error() : "";
    }

    public double deviceMemoryUsedGb() {
        return deviceMemoryUsedBytes / (1024.0 * 1024 * 1024);
    }

    public double deviceMemoryTotalGb() {
        return deviceMemoryTotalBytes / (1024.0 * 1024 * 1024);
    }
}
