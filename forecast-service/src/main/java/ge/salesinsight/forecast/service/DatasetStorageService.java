package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ResourceNotFoundException;
import ge.salesinsight.common.exception.SalesInsightException;
import ge.salesinsight.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Keeps uploaded spreadsheets and forecast outputs in the upload directory.
 *
 * The sanitized original filename is the dataset id; uploading a file with the
 * same name replaces the previous one.
 */
@Slf4j
@Service
public class DatasetStorageService {

    private static final String FORECAST_PREFIX = "forecast_";
    private static final String FORECAST_SUFFIX = ".csv";

    @Value("${sales.storage.upload-dir:uploads}")
    private String uploadDir;

    @Value("${sales.upload.max-file-size-bytes:16777216}")
    private long maxFileSize;

    /**
     * Validate and store an uploaded spreadsheet.
     *
     * @return path of the stored file; its file name is the dataset id
     */
    public Path store(MultipartFile file) {
        validateFile(file);
        String datasetId = sanitize(file.getOriginalFilename());
        Path target = directory().resolve(datasetId);

        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new SalesInsightException("Failed to store upload " + datasetId, e);
        }

        log.info("[{}] Stored upload ({} bytes) at {}", datasetId, file.getSize(), target);
        return target;
    }

    /**
     * @throws ResourceNotFoundException if no upload with this id exists
     */
    public Path resolve(String datasetId) {
        Path path = directory().resolve(sanitize(datasetId));
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException("Dataset", datasetId);
        }
        return path;
    }

    public Path forecastResultPath(String datasetId) {
        return directory().resolve(FORECAST_PREFIX + sanitize(datasetId) + FORECAST_SUFFIX);
    }

    public void delete(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted {}", path);
            }
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    private Path directory() {
        return Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    private String sanitize(String filename) {
        String cleaned = filename == null ? null : StringUtils.getFilename(StringUtils.cleanPath(filename.trim()));
        if (cleaned == null || cleaned.isBlank() || cleaned.contains("..")) {
            throw new ValidationException("file", "Invalid file name: " + filename);
        }
        return cleaned;
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("file", "File is required");
        }

        if (file.getSize() > maxFileSize) {
            throw new ValidationException("file",
                    String.format("File size exceeds maximum (%d bytes)", maxFileSize));
        }

        String filename = file.getOriginalFilename();
        String lower = filename != null ? filename.toLowerCase(Locale.ROOT) : null;
        if (lower == null || (!lower.endsWith(".xlsx") && !lower.endsWith(".xls"))) {
            throw new ValidationException("file", "File must be an Excel file (.xlsx or .xls)");
        }
    }
}
