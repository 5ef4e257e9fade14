package com.arbitration.award.gateway;

import com.arbitration.award.config.AwardConfig;
import com.arbitration.award.exception.ExternalServiceException;
import com.arbitration.award.exception.NotFoundException;
import com.arbitration.award.signing.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores documents under {@code award.storage.base-dir}/folder/caseId/filename. The hash is taken
 * from the bytes read back after the write, so it reflects what is actually on disk.
 */
@Component
public class FileSystemDocumentStorage implements DocumentStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStorage.class);

    private final Path baseDir;
    private final String publicBaseUrl;

    public FileSystemDocumentStorage(AwardConfig awardConfig) {
        this.baseDir = Path.of(awardConfig.getStorage().getBaseDir()).toAbsolutePath().normalize();
        this.publicBaseUrl = awardConfig.getStorage().getPublicBaseUrl();
    }

    @Override
    public StoredDocument store(byte[] data, StorageRequest request) {
        Path target = baseDir.resolve(request.folder())
                .resolve(request.caseId())
                .resolve(request.filename())
                .normalize();
        if (!target.startsWith(baseDir)) {
            throw new ExternalServiceException("storage", "Invalid storage path " + request.filename(), null);
        }

        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
            byte[] written = Files.readAllBytes(target);
            String hash = Digests.sha256Hex(written);
            log.info("Stored document {} ({} bytes, sha256={})", target, written.length, hash);
            return new StoredDocument(publicBaseUrl + baseDir.relativize(target).toString().replace('\\', '/'),
                    hash, written.length);
        } catch (IOException e) {
            throw new ExternalServiceException("storage", "Failed to store document: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] fetch(String url) {
        if (url == null || !url.startsWith(publicBaseUrl)) {
            throw new NotFoundException("Document not found: " + url);
        }
        Path path = baseDir.resolve(url.substring(publicBaseUrl.length())).normalize();
        if (!path.startsWith(baseDir) || !Files.exists(path)) {
            throw new NotFoundException("Document not found: " + url);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ExternalServiceException("storage", "Failed to read document: " + e.getMessage(), e);
        }
    }
}
