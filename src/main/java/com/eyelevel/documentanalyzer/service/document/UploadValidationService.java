package com.eyelevel.documentanalyzer.service.document;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

/**
 * A stateless service performing pre-flight checks on uploads.
 */
@Slf4j
@Service
public class UploadValidationService {

    /**
     * @param fileName The client supplied file name, may be {@code null}.
     * @param fileSize The size of the upload in bytes.
     * @return An error message string if validation fails, or {@code null} if the upload is acceptable.
     */
    public String validateUpload(final String fileName, final long fileSize) {
        log.trace("Validating upload '{}' with size {} bytes.", fileName, fileSize);

        if (fileSize <= 0) {
            return "File is empty or has an invalid size.";
        }

        if (fileName != null) {
            final String baseName = FilenameUtils.getName(fileName).trim();
            if (".".equals(baseName) || "..".equals(baseName)) {
                return "File has an invalid name.";
            }
        }
        return null;
    }
}
