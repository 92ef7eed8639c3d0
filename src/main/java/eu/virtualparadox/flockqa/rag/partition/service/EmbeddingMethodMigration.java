package eu.virtualparadox.flockqa.rag.partition.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;
import eu.virtualparadox.flockqa.rag.partition.model.PartitionArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static eu.virtualparadox.flockqa.rag.partition.service.DocumentArtifactReader.KEY_EMBEDDING_METHOD;
import static eu.virtualparadox.flockqa.rag.partition.service.DocumentArtifactReader.KEY_METHOD;

/**
 * Rewrites a non-canonical embedding label inside a partition artifact.
 * <p>
 * Steps, serialized across all partitions:
 * <ol>
 *   <li>copy the artifact to {@code <file>.backup} unless that backup already exists</li>
 *   <li>write the corrected envelope to a temp file next to the artifact</li>
 *   <li>atomically move the temp file over the artifact</li>
 * </ol>
 * The first backup is never overwritten, so it always holds the artifact as ingestion produced it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EmbeddingMethodMigration {

    public static final String BACKUP_SUFFIX = ".backup";

    private static final String TEMP_FILE_PREFIX = "heal-";
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final ObjectMapper objectMapper;

    private final Object writeLock = new Object();

    /**
     * @param artifact artifact whose label must be corrected; must be an envelope
     * @param method   canonical method to persist
     * @return true when the artifact was rewritten
     */
    public boolean migrate(final PartitionArtifact artifact, final EmbeddingMethod method) {
        if (!artifact.envelope() || !(artifact.root() instanceof ObjectNode root)) {
            log.debug("Artifact {} is not an envelope, label left as is", artifact.file());
            return false;
        }

        final Path file = artifact.file();
        final Path backup = backupOf(file);

        synchronized (writeLock) {
            try {
                if (Files.notExists(backup)) {
                    Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
                    log.info("Backed up {} to {}", file, backup);
                }

                final ObjectNode corrected = root.deepCopy();
                corrected.put(KEY_METHOD, method.label());
                corrected.put(KEY_EMBEDDING_METHOD, method.label());

                final Path temp = Files.createTempFile(file.toAbsolutePath().getParent(), TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
                try {
                    objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), corrected);
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    Files.deleteIfExists(temp);
                }

                log.info("Migrated embedding label of {}: {} -> '{}'", file, artifact.labels(), method.label());
                return true;
            } catch (IOException e) {
                log.error("Failed to rewrite embedding label of {}", file, e);
                return false;
            }
        }
    }

    public static Path backupOf(final Path file) {
        return file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
    }
}
