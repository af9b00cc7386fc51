package com.ora.normalization.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 checksums of files and the companion checksum file format ({@code <hex>  <file name>}).
 */
public class FileChecksums {

    public static final String EXTENSION = ".sha256";

    private FileChecksums() {
        // Utility class - prevent instantiation
    }

    public static String sha256(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            while (in.read(buffer) != -1) {
                // digest is updated as the stream is read
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static Path checksumFileFor(Path file) {
        return file.resolveSibling(file.getFileName() + EXTENSION);
    }

    public static Path writeChecksumFile(Path file, String checksum) throws IOException {
        Path checksumFile = checksumFileFor(file);
        Files.writeString(checksumFile, checksum + "  " + file.getFileName() + System.lineSeparator());
        return checksumFile;
    }

    /**
     * Reads the checksum recorded for a file, or {@code null} when no checksum file exists.
     */
    public static String readRecordedChecksum(Path file) throws IOException {
        Path checksumFile = checksumFileFor(file);
        if (!Files.isRegularFile(checksumFile)) {
            return null;
        }
        String content = Files.readString(checksumFile).trim();
        int separator = content.indexOf(' ');
        return separator < 0 ? content : content.substring(0, separator);
    }
}
