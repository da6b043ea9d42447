package ge.salesinsight.forecast.service;

import ge.salesinsight.common.exception.ResourceNotFoundException;
import ge.salesinsight.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatasetStorageServiceTest {

    @TempDir
    Path uploadDir;

    private DatasetStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new DatasetStorageService();
        ReflectionTestUtils.setField(storage, "uploadDir", uploadDir.toString());
        ReflectionTestUtils.setField(storage, "maxFileSize", 1024L);
    }

    @Test
    void store_ShouldWriteFileNamedAfterUpload() throws IOException {
        Path stored = storage.store(excel("sales.xlsx", "first"));

        assertEquals("sales.xlsx", stored.getFileName().toString());
        assertEquals("first", Files.readString(stored));
        assertEquals(stored, storage.resolve("sales.xlsx"));
    }

    @Test
    void store_SameName_ShouldReplacePreviousUpload() throws IOException {
        storage.store(excel("sales.xlsx", "first"));
        Path stored = storage.store(excel("sales.xlsx", "second"));

        assertEquals("second", Files.readString(stored));
    }

    @Test
    void store_PathSegments_ShouldBeStripped() {
        Path stored = storage.store(excel("../../etc/sales.xlsx", "data"));

        assertEquals(uploadDir.toAbsolutePath().normalize(), stored.getParent());
        assertEquals("sales.xlsx", stored.getFileName().toString());
    }

    @Test
    void store_EmptyFile_ShouldFail() {
        assertThrows(ValidationException.class, () -> storage.store(excel("sales.xlsx", "")));
    }

    @Test
    void store_WrongExtension_ShouldFail() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> storage.store(excel("sales.csv", "a,b")));
        assertTrue(ex.getMessage().contains(".xlsx"));
    }

    @Test
    void store_TooLarge_ShouldFail() {
        assertThrows(ValidationException.class, () -> storage.store(excel("sales.xlsx", "x".repeat(2048))));
    }

    @Test
    void resolve_UnknownDataset_ShouldThrowNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> storage.resolve("missing.xlsx"));
    }

    @Test
    void forecastResultPath_ShouldLiveNextToUploads() {
        Path result = storage.forecastResultPath("sales.xlsx");

        assertEquals("forecast_sales.xlsx.csv", result.getFileName().toString());
        assertEquals(uploadDir.toAbsolutePath().normalize(), result.getParent());
    }

    @Test
    void delete_MissingFile_ShouldBeNoOp() {
        assertDoesNotThrow(() -> storage.delete(uploadDir.resolve("nothing.csv")));
    }

    private MockMultipartFile excel(String name, String content) {
        return new MockMultipartFile("file", name,
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", content.getBytes());
    }
}
