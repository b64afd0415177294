package com.eyelevel.documentanalyzer.service.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UploadValidationService Unit Tests")
class UploadValidationServiceTest {

    private final UploadValidationService uploadValidationService = new UploadValidationService();

    @Test
    @DisplayName("Should accept a non-empty upload")
    void shouldAcceptNonEmptyUpload() {
        assertThat(uploadValidationService.validateUpload("invoice.txt", 120)).isNull();
        assertThat(uploadValidationService.validateUpload(null, 120)).isNull();
    }

    @Test
    @DisplayName("Should reject an empty upload")
    void shouldRejectEmptyUpload() {
        assertThat(uploadValidationService.validateUpload("invoice.txt", 0)).isEqualTo("File is empty or has an invalid size.");
    }

    @Test
    @DisplayName("Should reject directory-like names")
    void shouldRejectDotNames() {
        assertThat(uploadValidationService.validateUpload("..", 10)).isNotNull();
        assertThat(uploadValidationService.validateUpload("a/.", 10)).isNotNull();
    }
}
