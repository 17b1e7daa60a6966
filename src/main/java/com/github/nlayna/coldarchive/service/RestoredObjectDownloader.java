package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.client.ObjectContent;
import com.github.nlayna.coldarchive.client.ObjectStoreClient;
import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.exception.PermanentTransferException;
import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.exception.TransientTransferException;
import com.github.nlayna.coldarchive.model.DownloadResult;
import com.github.nlayna.coldarchive.model.UploadConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams a readable object to a local file. Bytes land in a {@code .part} sibling first and are
 * moved over the destination only once the transfer (and checksum, where possible) succeeded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestoredObjectDownloader {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final long PROGRESS_INTERVAL = UploadConfig.MIB;

    @FunctionalInterface
    public interface ProgressCallback {
        void onProgress(long downloadedBytes, long totalBytes);
    }

    private final ObjectStoreClient objectStore;
    private final ArchiveProperties archiveProperties;

    public DownloadResult download(String key, Path localPath, ProgressCallback callback) throws TransferException {
        log.info("Downloading {} -> {}", key, localPath);
        Path parentDir = localPath.toAbsolutePath().getParent();
        try {
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
        } catch (IOException e) {
            throw new PermanentTransferException("Failed to create parent directory: " + parentDir, e);
        }

        Path tempFile = localPath.resolveSibling(localPath.getFileName() + ".part");
        try (ObjectContent content = objectStore.openObject(key)) {
            DownloadResult result = copyWithStreams(key, content, tempFile, callback);
            Files.move(tempFile, localPath, StandardCopyOption.REPLACE_EXISTING);
            return result;
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new TransientTransferException(e.getMessage(), e);
        } catch (TransferException e) {
            deleteQuietly(tempFile);
            throw e;
        }
    }

    private DownloadResult copyWithStreams(String key, ObjectContent content, Path target, ProgressCallback callback)
            throws IOException {
        String expectedMd5 = singlePartMd5(content.eTag());
        boolean verify = archiveProperties.getDownload().isChecksumEnabled() && expectedMd5 != null;

        MessageDigest digest = null;
        if (verify) {
            try {
                digest = MessageDigest.getInstance("MD5");
            } catch (NoSuchAlgorithmException e) {
                throw new IOException("MD5 algorithm not available", e);
            }
        }

        long totalBytes = content.contentLength();
        long downloaded = 0;
        long lastReported = 0;
        try (InputStream in = verify ? new DigestInputStream(content.stream(), digest) : content.stream();
             OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = in.read(buffer)) != -1) {
                out.write(buffer, 0, bytesRead);
                downloaded += bytesRead;
                if (downloaded - lastReported >= PROGRESS_INTERVAL) {
                    callback.onProgress(downloaded, totalBytes);
                    lastReported = downloaded;
                }
            }
        }
        callback.onProgress(downloaded, totalBytes);

        if (verify) {
            String actualMd5 = bytesToHex(digest.digest());
            if (!actualMd5.equalsIgnoreCase(expectedMd5)) {
                throw new IOException("Checksum mismatch for " + key + ": remote=" + expectedMd5 + ", local=" + actualMd5);
            }
            log.debug("Checksum verified for {}: {}", key, actualMd5);
        }
        return new DownloadResult(downloaded, verify);
    }

    /**
     * The MD5 hex digest carried by an ETag, or null for multipart ETags ({@code "<hash>-<parts>"}),
     * which are not a digest of the content.
     */
    static String singlePartMd5(String eTag) {
        if (eTag == null) {
            return null;
        }
        String value = eTag.replace("\"", "");
        if (value.contains("-") || value.length() != 32) {
            return null;
        }
        return value;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete partial download {}: {}", file, e.getMessage());
        }
    }
}
