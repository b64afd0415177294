package com.eyelevel.documentanalyzer.service.storage;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileStorageService Unit Tests")
class FileStorageServiceTest {

    @TempDir
    Path tempDir;

    private FileStorageService fileStorageService;

    @BeforeEach
    void setUp() {
        DocumentProcessingConfig config = new DocumentProcessingConfig();
        config.getStorage().setUploadDir(tempDir.resolve("uploads").toString());
        fileStorageService = new FileStorageService(config);
    }

    @Test
    @DisplayName("Should write the content under the upload directory")
    void shouldStoreContent() throws IOException {
        Path stored = fileStorageService.store("abc-invoice.txt", "Total: $5.00".getBytes(StandardCharsets.UTF_8));

        assertThat(stored).isEqualTo(fileStorageService.getUploadDir().resolve("abc-invoice.txt"));
        assertThat(Files.readString(stored)).isEqualTo("Total: $5.00");
    }

    @Test
    @DisplayName("Should never overwrite an existing file")
    void shouldNotOverwrite() throws IOException {
        fileStorageService.store("same.txt", new byte[]{1});

        assertThatThrownBy(() -> fileStorageService.store("same.txt", new byte[]{2}))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readAllBytes(fileStorageService.getUploadDir().resolve("same.txt"))).containsExactly(1);
    }

    @Test
    @DisplayName("Should remove a partially written file so the write can be attempted again")
    void shouldRemovePartialFileAfterFailedWrite() throws IOException {
        // Given
        DocumentProcessingConfig config = new DocumentProcessingConfig();
        config.getStorage().setUploadDir(tempDir.resolve("flaky").toString());
        FileStorageService flakyStorage = new FileStorageService(config) {
            private boolean failed;

            @Override
            void writeContent(Path target, byte[] content) throws IOException {
                if (!failed) {
                    failed = true;
                    Files.write(target, Arrays.copyOf(content, 3), StandardOpenOption.CREATE_NEW);
                    throw new IOException("disk full");
                }
                super.writeContent(target, content);
            }
        };
        byte[] content = "Total: $5.00".getBytes(StandardCharsets.UTF_8);

        // When
        assertThatThrownBy(() -> flakyStorage.store("partial.txt", content))
                .isInstanceOf(IOException.class)
                .hasMessage("disk full");

        // Then
        Path target = flakyStorage.getUploadDir().resolve("partial.txt");
        assertThat(target).doesNotExist();
        assertThat(Files.readString(flakyStorage.store("partial.txt", content))).isEqualTo("Total: $5.00");
    }

    @Test
    @DisplayName("Should refuse names that escape the upload directory")
    void shouldRejectTraversal() {
        assertThatThrownBy(() -> fileStorageService.store("../outside.txt", new byte[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should build unique names that keep only the base name")
    void shouldBuildStoredName() {
        String first = FileStorageService.buildStoredName("../../etc/invoice.txt");
        String second = FileStorageService.buildStoredName("../../etc/invoice.txt");

        assertThat(first).endsWith("-invoice.txt").doesNotContain("/");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Should delete a stored file")
    void shouldDeleteStoredFile() throws IOException {
        Path stored = fileStorageService.store("gone.txt", new byte[]{1});

        fileStorageService.delete(stored);

        assertThat(stored).doesNotExist();
    }
}
