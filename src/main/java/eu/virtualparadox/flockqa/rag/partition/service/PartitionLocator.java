package eu.virtualparadox.flockqa.rag.partition.service;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the on-disk directory of a partition.
 * <p>
 * Precedence, first existing directory wins:
 * <ol>
 *   <li>{@code flockqa.storage.overrides.<partition>}</li>
 *   <li>{@code flockqa.storage.root/<partition>}</li>
 *   <li>{@code <fallback>/<partition>} for each configured fallback path, in order</li>
 * </ol>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PartitionLocator {

    private final ApplicationConfig config;

    /**
     * @param partitionId partition identifier (case-insensitive)
     * @return the first existing candidate directory, or empty when none exists
     */
    public Optional<Path> locate(final String partitionId) {
        for (final Path candidate : candidates(partitionId)) {
            if (Files.isDirectory(candidate)) {
                log.debug("Partition {} resolved to {}", partitionId, candidate);
                return Optional.of(candidate);
            }
        }
        log.warn("No directory found for partition {} (tried {})", partitionId, candidates(partitionId));
        return Optional.empty();
    }

    /**
     * @return every location considered for {@code partitionId}, in precedence order
     */
    public List<Path> candidates(final String partitionId) {
        final String id = partitionId.toLowerCase(Locale.ROOT);
        final ApplicationConfig.Storage storage = config.getStorage();
        final List<Path> candidates = new ArrayList<>();

        final Path override = storage.getOverrides().get(id);
        if (override != null) {
            candidates.add(override);
        }
        if (storage.getRoot() != null) {
            candidates.add(storage.getRoot().resolve(id));
        }
        for (final Path fallback : storage.getFallbackPaths()) {
            candidates.add(fallback.resolve(id));
        }
        return candidates;
    }
}
