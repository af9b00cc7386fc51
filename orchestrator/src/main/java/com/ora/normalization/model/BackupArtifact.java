package com.ora.normalization.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A snapshot file of the store.
 */
public record BackupArtifact(Path path, String checksum, LocalDateTime createdAt, boolean verified) {
}
