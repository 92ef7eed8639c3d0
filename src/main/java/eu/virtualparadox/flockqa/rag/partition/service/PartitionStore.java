package eu.virtualparadox.flockqa.rag.partition.service;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethodNormalizer;
import eu.virtualparadox.flockqa.rag.index.LuceneSimilarityIndex;
import eu.virtualparadox.flockqa.rag.index.SimilarityIndex;
import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.partition.model.Partition;
import eu.virtualparadox.flockqa.rag.partition.model.PartitionArtifact;
import eu.virtualparadox.flockqa.rag.partition.model.PartitionStatus;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every loaded knowledge partition.
 * <p>
 * A partition is read from disk at most once per process. Concurrent first loads of the same
 * partition are serialized on a per-partition lock; loads of different partitions proceed in
 * parallel. A failed load is not remembered, so a later call retries it. Only the configured
 * partitions ({@code flockqa.partitions}) can be loaded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PartitionStore {

    private final ApplicationConfig config;
    private final PartitionLocator locator;
    private final DocumentArtifactReader artifactReader;
    private final DocumentNormalizer normalizer;
    private final EmbeddingMethodMigration migration;

    private final Map<String, Partition> loaded = new ConcurrentHashMap<>();
    private final Map<String, Object> loadLocks = new ConcurrentHashMap<>();

    /**
     * Loads the partition unless it is already resident.
     *
     * @param partitionId partition identifier (case-insensitive)
     * @return true when the partition is available for search, false for unknown ids
     */
    public boolean ensureLoaded(final String partitionId) {
        if (partitionId == null || partitionId.isBlank()) {
            return false;
        }
        final String id = partitionId.toLowerCase(Locale.ROOT);
        if (loaded.containsKey(id)) {
            return true;
        }
        if (!isConfigured(id)) {
            log.warn("Refusing to load unknown partition '{}' (configured: {})", id, config.getPartitions().all());
            return false;
        }

        synchronized (loadLocks.computeIfAbsent(id, k -> new Object())) {
            if (loaded.containsKey(id)) {
                return true;
            }
            try {
                final Partition partition = load(id);
                loaded.put(id, partition);
                log.info("Loaded partition {} from {}: {} vectors, {} documents, method {}, dimension {}",
                        id, partition.location(), partition.index().size(), partition.documents().size(),
                        partition.embeddingMethod().label(), partition.dimensionality());
                return true;
            } catch (PartitionLoadException e) {
                log.warn("Partition {} unavailable: {}", id, e.getMessage());
                return false;
            } catch (RuntimeException e) {
                log.error("Unexpected failure loading partition {}", id, e);
                return false;
            }
        }
    }

    /**
     * @return the loaded partition, without triggering a load
     */
    public Optional<Partition> find(final String partitionId) {
        if (partitionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(loaded.get(partitionId.toLowerCase(Locale.ROOT)));
    }

    public boolean isLoaded(final String partitionId) {
        return find(partitionId).isPresent();
    }

    /**
     * @return status of every configured partition, keyed by id
     */
    public Map<String, PartitionStatus> describe() {
        final Map<String, PartitionStatus> statuses = new LinkedHashMap<>();
        for (final String id : config.getPartitions().all()) {
            final String key = id.toLowerCase(Locale.ROOT);
            statuses.put(key, find(key).map(PartitionStatus::of).orElseGet(() -> PartitionStatus.notLoaded(key)));
        }
        return statuses;
    }

    private boolean isConfigured(final String id) {
        return config.getPartitions().all().stream().anyMatch(id::equalsIgnoreCase);
    }

    private Partition load(final String id) {
        final Path directory = locator.locate(id)
                .orElseThrow(() -> new PartitionLoadException("no directory among " + locator.candidates(id)));

        final ApplicationConfig.Storage storage = config.getStorage();
        final Path indexDir = directory.resolve(storage.getIndexDirectory());
        final Path documentsFile = directory.resolve(storage.getDocumentsFile());
        if (!Files.isDirectory(indexDir) || !Files.isRegularFile(documentsFile)) {
            throw new PartitionLoadException("index files missing in " + directory
                    + " (expected " + indexDir.getFileName() + "/ and " + documentsFile.getFileName() + ")");
        }

        final PartitionArtifact artifact = artifactReader.read(documentsFile);
        final EmbeddingMethod method = resolveMethod(id, artifact);
        final List<DocumentRecord> documents = normalizer.normalize(artifact.documents());

        final SimilarityIndex index = openIndex(indexDir);
        if (index.size() != documents.size()) {
            log.warn("Partition {} holds {} vectors but {} documents; hits without a document are dropped",
                    id, index.size(), documents.size());
        }
        return new Partition(id, directory, index, documents, method, index.dimension());
    }

    /**
     * The {@code method} key wins over {@code embedding_method}. Both keys are rewritten to the
     * canonical label when either one differs from it.
     */
    private EmbeddingMethod resolveMethod(final String id, final PartitionArtifact artifact) {
        final String raw = artifact.label();
        if (raw == null) {
            final EmbeddingMethod fallback = config.getEmbedding().getDefaultMethod();
            log.info("Partition {} carries no embedding label, assuming {}", id, fallback.label());
            return fallback;
        }

        final EmbeddingMethod canonical = EmbeddingMethodNormalizer.canonicalize(raw);
        final boolean consistent = artifact.labels().stream().allMatch(canonical.label()::equals);
        if (!EmbeddingMethodNormalizer.isCanonical(raw)) {
            log.info("Partition {} labelled '{}', treated as {}", id, raw, canonical.label());
        } else if (!consistent) {
            log.info("Partition {} carries conflicting labels {}, keeping {}", id, artifact.labels(), canonical.label());
        }
        if (!consistent && config.getStorage().isSelfHeal()) {
            migration.migrate(artifact, canonical);
        }
        return canonical;
    }

    private static SimilarityIndex openIndex(final Path indexDir) {
        try {
            return LuceneSimilarityIndex.open(indexDir);
        } catch (IOException e) {
            throw new PartitionLoadException("cannot open index " + indexDir, e);
        }
    }

    @PreDestroy
    public void close() {
        loaded.values().forEach(p -> {
            try {
                p.index().close();
            } catch (IOException e) {
                log.warn("Failed to close index of partition {}", p.id(), e);
            }
        });
        loaded.clear();
    }
}
