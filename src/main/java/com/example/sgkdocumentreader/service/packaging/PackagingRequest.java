package com.example.sgkdocumentreader.service.packaging;

import com.example.sgkdocumentreader.model.ClassificationResult;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.model.RectifiedImage;

import java.util.Objects;

/**
 * @param patientName   name of the linked patient, else the extracted name, else null
 * @param nameExtracted whether the page yielded a name candidate at all
 */
public record PackagingRequest(RectifiedImage image,
                               String patientName,
                               ClassificationResult classification,
                               MatchTier tier,
                               boolean nameExtracted) {

    public PackagingRequest {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(tier, "tier");
    }
}
