package com.ora.normalization.model;

/**
 * Primary and secondary snapshot taken for one run, identified by the run timestamp.
 */
public record BackupSet(String backupId, BackupArtifact primary, BackupArtifact secondary) {

    public boolean isVerified() {
        return primary.verified()
            && secondary.verified()
            && primary.checksum().equals(secondary.checksum());
    }
}
