package fr.lapetina.advisor.llm.infrastructure.device;

import java.util.Locale;

/**
 * Reports memory usage of the compute device holding the weights.
 *
 * Probes are called outside the lifecycle state lock and may be slow;
 * implementations must be thread-safe.
 */
public interface DeviceMemoryProbe {

    /**
     * Device name shown in the status, {@code "none"} without placement.
     */
    String device();

    long usedBytes();

    long totalBytes();

    /**
     * Probe for hosts without an accelerator: always reports zero.
     */
    static DeviceMemoryProbe none() {
        return new DeviceMemoryProbe() {
            @Override
            public String device() {
                return "none";
            }

            @Override
            public long usedBytes() {
                return 0;
            }

            @Override
            public long totalBytes() {
                return 0;
            }
        };
    }

    /**
     * Probe for weights placed on the JVM heap (CPU inference).
     */
    static DeviceMemoryProbe heap() {
        return new DeviceMemoryProbe() {
            @Override
            public String device() {
                return "cpu";
            }

            @Override
            public long usedBytes() {
                Runtime runtime = Runtime.getRuntime();
                return runtime.totalMemory() - runtime.freeMemory();
            }

            @Override
            public long totalBytes() {
                return Runtime.getRuntime().maxMemory();
            }
        };
    }

    /**
     * Resolves a configured device name: {@code cpu} or {@code heap} probe the
     * JVM heap, anything else reports zeros.
     */
    static DeviceMemoryProbe forDevice(String device) {
        if (device == null) {
            return none();
        }
        return switch (device.strip().toLowerCase(Locale.ROOT)) {
            case "cpu", "heap" -> heap();
            default -> none();
        };
    }
}
