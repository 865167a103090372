package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.UploadedFile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class UploadValidator {

    private final List<String> allowedTypes;
    private final long maxBytes;

    @Autowired
    public UploadValidator(PipelineProperties properties) {
        this(properties.getUpload().getAllowedTypes(), properties.getUpload().getMaxBytes());
    }

    UploadValidator(List<String> allowedTypes, long maxBytes) {
        this.allowedTypes = allowedTypes.stream().map(type -> type.toLowerCase(Locale.ROOT)).toList();
        this.maxBytes = maxBytes;
    }

    /** Returns the canonical media type of an acceptable upload. */
    public String validate(UploadedFile file) {
        String mediaType = canonicalType(file.mediaType());
        if (!allowedTypes.contains(mediaType)) {
            throw new ValidationException(
                    "Unsupported media type '" + file.mediaType() + "' for " + file.fileName(),
                    "Unsupported file type, allowed types are JPEG, PNG, TIFF and PDF");
        }
        if (file.size() == 0) {
            throw new ValidationException("Empty upload " + file.fileName(), "The uploaded file is empty");
        }
        if (file.size() > maxBytes) {
            throw new ValidationException(
                    "Upload " + file.fileName() + " is " + file.size() + " bytes, limit is " + maxBytes,
                    "The file is larger than the " + (maxBytes / (1024 * 1024)) + " MB limit");
        }
        return mediaType;
    }

    static String canonicalType(String mediaType) {
        if (mediaType == null) {
            return "";
        }
        String type = mediaType.toLowerCase(Locale.ROOT);
        int parameters = type.indexOf(';');
        if (parameters >= 0) {
            type = type.substring(0, parameters);
        }
        type = type.trim();
        return switch (type) {
            case "image/jpg", "image/pjpeg" -> "image/jpeg";
            case "image/tif" -> "image/tiff";
            default -> type;
        };
    }
}
