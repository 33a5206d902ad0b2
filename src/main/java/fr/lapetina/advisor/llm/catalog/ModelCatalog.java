package fr.lapetina.advisor.llm.catalog;

import fr.lapetina.advisor.llm.domain.model.ModelId;
import fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig;
import fr.lapetina.advisor.llm.infrastructure.config.ConfigChangeListener;
import fr.lapetina.advisor.llm.infrastructure.store.WeightStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Models offered to the dashboard, keyed by display name.
 *
 * The list comes from the {@code catalog} configuration section, falling
 * back to the Qwen3 family, and is replaced on configuration reload.
 */
public final class ModelCatalog implements ConfigChangeListener {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    private static final List<Entry> DEFAULTS = List.of(
            new Entry("Qwen3-4B", ModelId.of("Qwen/Qwen3-4B"), 8_044_936_192L),
            new Entry("Qwen3-8B", ModelId.of("Qwen/Qwen3-8B"), 16_381_470_720L),
            new Entry("Qwen3-14B", ModelId.of("Qwen/Qwen3-14B"), 29_536_614_400L),
            new Entry("Qwen3-32B", ModelId.of("Qwen/Qwen3-32B"), 65_524_246_528L)
    );

    private final AtomicReference<List<Entry>> entries;
    private final WeightStore weightStore;

    public ModelCatalog(List<Entry> entries, WeightStore weightStore) {
        this.entries = new AtomicReference<>(entries.isEmpty() ? DEFAULTS : List.copyOf(entries));
        this.weightStore = Objects.requireNonNull(weightStore, "Weight store is required");
    }

    public static ModelCatalog fromConfig(AdvisorConfig config, WeightStore weightStore) {
        return new ModelCatalog(entriesFrom(config), weightStore);
    }

    public static List<Entry> defaults() {
        return DEFAULTS;
    }

    public List<Entry> entries() {
        return entries.get();
    }

    /**
     * Finds a model by display name (case-insensitive) or by exact id.
     */
    public Optional<Entry> find(String nameOrId) {
        if (nameOrId == null || nameOrId.isBlank()) {
            return Optional.empty();
        }
        String key = nameOrId.strip();
        return entries.get().stream()
                .filter(e -> e.name().equalsIgnoreCase(key) || e.id().value().equals(key))
                .findFirst();
    }

    public Optional<ModelId> resolve(String nameOrId) {
        return find(nameOrId).map(Entry::id);
    }

    /**
     * Measured local cache size next to the published size, per model.
     */
    public List<EntryStatus> sizes() {
        return entries.get().stream()
                .map(e -> new EntryStatus(e.name(), e.id().value(),
                        weightStore.sizeOnDisk(e.id()), e.officialWeightBytes()))
                .toList();
    }

    @Override
    public void onConfigChanged(AdvisorConfig oldConfig, AdvisorConfig newConfig) {
        List<Entry> updated = entriesFrom(newConfig);
        entries.set(updated.isEmpty() ? DEFAULTS : updated);
        log.info("Model catalog refreshed: models={}", entries.get().size());
    }

    private static List<Entry> entriesFrom(AdvisorConfig config) {
        if (config == null || config.getCatalog() == null) {
            return List.of();
        }
        return config.getCatalog().stream()
                .map(c -> new Entry(c.getName(), ModelId.of(c.getId()), c.getOfficialWeightBytes()))
                .toList();
    }

    /**
     * A selectable model.
     *
     * @param officialWeightBytes published size of the weights, 0 when unknown
     */
    public record Entry(String name, ModelId id, long officialWeightBytes) {
        public Entry {
            Objects.requireNonNull(name, "Name is required");
            Objects.requireNonNull(id, "Model id is required");
        }
    }

    public record EntryStatus(String name, String id, long localBytes, long officialWeightBytes) {

        public boolean cached() {
            return localBytes > 0;
        }
    }
}
