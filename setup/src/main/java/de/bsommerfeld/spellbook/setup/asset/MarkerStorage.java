package de.bsommerfeld.spellbook.setup.asset;

import de.bsommerfeld.spellbook.db.MetaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Where an installed artifact keeps the marker of the release it came from.
 */
public enum MarkerStorage {

    /**
     * {@code release_updated_at} in the artifact's own {@code meta} table.
     * Only for SQLite artifacts. The marker is written into the staged copy,
     * so artifact and marker are installed by the same rename.
     */
    META_TABLE {
        @Override
        public Optional<String> read(Path artifact) {
            return MetaTable.readValue(artifact, MetaTable.RELEASE_UPDATED_AT);
        }

        @Override
        void beforeInstall(Path staged, Path target, String marker) throws IOException, SQLException {
            MetaTable.writeValue(staged, MetaTable.RELEASE_UPDATED_AT, marker);
        }

        @Override
        void afterInstall(Path target, String marker) {
        }
    },

    /**
     * A {@code <artifact>.release} text file next to the artifact, for
     * formats this pipeline cannot open. Written after the artifact is in
     * place; an artifact without its sidecar counts as unversioned and is
     * downloaded again.
     */
    SIDECAR_FILE {
        @Override
        public Optional<String> read(Path artifact) {
            Path sidecar = sidecar(artifact);
            if (!Files.isRegularFile(artifact) || !Files.isRegularFile(sidecar)) {
                return Optional.empty();
            }
            try {
                String marker = Files.readString(sidecar, StandardCharsets.UTF_8).trim();
                return marker.isEmpty() ? Optional.empty() : Optional.of(marker);
            } catch (IOException e) {
                LOG.debug("Unreadable release marker {}: {}", sidecar, e.getMessage());
                return Optional.empty();
            }
        }

        @Override
        void beforeInstall(Path staged, Path target, String marker) throws IOException {
            // a stale marker must never describe the new artifact
            Files.deleteIfExists(sidecar(target));
        }

        @Override
        void afterInstall(Path target, String marker) throws IOException {
            Path sidecar = sidecar(target);
            Path temp = sidecar.resolveSibling(sidecar.getFileName() + ".tmp");
            Files.writeString(temp, marker, StandardCharsets.UTF_8);
            Files.move(temp, sidecar, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
    };

    private static final Logger LOG = LoggerFactory.getLogger(MarkerStorage.class);

    /** Marker of the installed artifact, empty if absent or unreadable. */
    public abstract Optional<String> read(Path artifact);

    abstract void beforeInstall(Path staged, Path target, String marker) throws IOException, SQLException;

    abstract void afterInstall(Path target, String marker) throws IOException;

    static Path sidecar(Path artifact) {
        return artifact.resolveSibling(artifact.getFileName() + ".release");
    }
}
