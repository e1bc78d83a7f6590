package com.example.campusevents.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Local-disk upload store. Files live under {@code <upload-dir>/<category>/} and are served
 * read-only from {@code /uploads/<category>/<file>}.
 */
@Service
public class FileStorageService {

    public static final String URL_PREFIX = "/uploads/";

    private static final Logger log = LoggerFactory.getLogger(FileStorageService.class);

    private final Path root;
    private final String publicBaseUrl;
    private final Clock clock;

    public FileStorageService(@Value("${app.upload-dir:uploads}") String uploadDir,
                              @Value("${app.public-base-url:}") String publicBaseUrl,
                              Clock clock) {
        this.root = Path.of(uploadDir).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl == null ? "" : publicBaseUrl.replaceAll("/+$", "");
        this.clock = clock;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Writes raw image bytes as {@code <scopeKey>_<epochMillis>_<8 hex>.jpg}.
     *
     * @return public URL of the stored file
     */
    public String save(byte[] bytes, String category, String scopeKey) {
        String fileName = scopeKey + "_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8) + ".jpg";
        Path target = categoryDir(category).resolve(fileName);
        try {
            Files.write(target, bytes);
        } catch (IOException ex) {
            throw new StorageException("Failed to save file " + fileName, ex);
        }
        log.info("Stored {} ({} bytes) in {}", fileName, bytes.length, category);
        return toUrl(category, fileName);
    }

    /**
     * Stores a multipart upload under a random name keeping the original extension.
     */
    public String store(MultipartFile file, String category) {
        String ext = StringUtils.getFilenameExtension(file.getOriginalFilename());
        String fileName = UUID.randomUUID() + (ext == null ? "" : "." + ext.toLowerCase(Locale.ROOT));
        Path target = categoryDir(category).resolve(fileName);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new StorageException("Failed to store upload " + file.getOriginalFilename(), ex);
        }
        log.info("Stored upload {} as {} in {}", file.getOriginalFilename(), fileName, category);
        return toUrl(category, fileName);
    }

    /**
     * Removes the file behind a URL produced by this service.
     *
     * @return true if a file was deleted
     */
    public boolean delete(String url) {
        Path path = resolve(url);
        if (path == null) return false;
        try {
            return Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete {}: {}", path, ex.getMessage());
            return false;
        }
    }

    Path resolve(String url) {
        if (url == null || url.isBlank()) return null;
        int idx = url.indexOf(URL_PREFIX);
        if (idx < 0) return null;
        Path path = root.resolve(url.substring(idx + URL_PREFIX.length())).normalize();
        // never leave the upload root
        return path.startsWith(root) ? path : null;
    }

    private Path categoryDir(String category) {
        Path dir = root.resolve(category);
        try {
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new StorageException("Cannot create upload directory " + dir, ex);
        }
        return dir;
    }

    private String toUrl(String category, String fileName) {
        return publicBaseUrl + URL_PREFIX + category + "/" + fileName;
    }
}
