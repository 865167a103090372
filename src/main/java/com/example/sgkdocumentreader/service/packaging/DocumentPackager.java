package com.example.sgkdocumentreader.service.packaging;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.model.CompressionAttempt;
import com.example.sgkdocumentreader.model.PackagedDocument;
import com.example.sgkdocumentreader.util.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a rectified page into a PDF no larger than the configured budget.
 * The first pass keeps quality high; when that is too large a fixed
 * compression plan is walked until a result fits. If nothing fits, the last
 * attempt is kept unless the budget is enforced as a hard limit. A placeholder
 * page stands in for the document when encoding fails.
 */
@Service
public class DocumentPackager {

    private static final Logger log = LoggerFactory.getLogger(DocumentPackager.class);

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm", Locale.ROOT);

    private final PdfDocumentWriter writer;
    private final FilenameGenerator filenameGenerator;
    private final Clock clock;
    private final PipelineProperties.Packaging settings;

    @Autowired
    public DocumentPackager(PdfDocumentWriter writer, FilenameGenerator filenameGenerator, Clock clock,
                            PipelineProperties properties) {
        this(writer, filenameGenerator, clock, properties.getPackaging());
    }

    DocumentPackager(PdfDocumentWriter writer, FilenameGenerator filenameGenerator, Clock clock,
                     PipelineProperties.Packaging settings) {
        this.writer = writer;
        this.filenameGenerator = filenameGenerator;
        this.clock = clock;
        this.settings = settings;
    }

    public PackagedDocument pack(PackagingRequest request) {
        String fileName = filenameGenerator.generate(request.patientName(),
                request.classification().type(), request.classification().confidence(),
                request.tier(), request.nameExtracted());
        String footer = footer(request, fileName);
        List<CompressionAttempt> attempts = new ArrayList<>();
        long budget = settings.getBudgetBytes();
        BufferedImage source = request.image().image();

        try {
            BufferedImage initial = ImagePreprocessor.toRgb(
                    ImagePreprocessor.scaleToMaxDimension(source, settings.getInitialMaxDimension()));
            byte[] pdf = writer.writeImagePage(initial, settings.getInitialQuality(), footer);
            attempts.add(new CompressionAttempt(0, settings.getInitialQuality(), initial.getWidth(), pdf.length));
            if (pdf.length <= budget) {
                log.debug("Packaged {} in one pass ({} bytes)", fileName, pdf.length);
                return new PackagedDocument(pdf, fileName, attempts, false);
            }
            log.info("Initial package of {} is {} bytes, over the {} byte budget; compressing",
                    fileName, pdf.length, budget);

            byte[] last = null;
            for (CompressionPlan.Step step : CompressionPlan.plan(source.getWidth(),
                    settings.getCompressionStartQuality(), settings.getCompressionStartWidth(),
                    settings.getQualityFactor(), settings.getDimensionFactor(), settings.getMaxAttempts())) {
                BufferedImage scaled = ImagePreprocessor.scaleToWidth(source, step.width());
                byte[] candidate = writer.writeImagePage(scaled, step.quality(), footer);
                attempts.add(new CompressionAttempt(step.attempt(), step.quality(), scaled.getWidth(), candidate.length));
                log.debug("Compression attempt {} (quality {}, width {}): {} bytes",
                        step.attempt(), step.quality(), scaled.getWidth(), candidate.length);
                if (candidate.length <= budget) {
                    return new PackagedDocument(candidate, fileName, attempts, false);
                }
                last = candidate;
            }

            if (!settings.isEnforceHardBudget() && last != null) {
                log.warn("No compression attempt fit the budget for {}; keeping the last attempt ({} bytes)",
                        fileName, last.length);
                return new PackagedDocument(last, fileName, attempts, false);
            }
            log.warn("No compression attempt fit the budget for {}; writing a placeholder", fileName);
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to package {}; writing a placeholder", fileName, ex);
        }
        return placeholder(fileName, attempts);
    }

    private PackagedDocument placeholder(String fileName, List<CompressionAttempt> attempts) {
        List<String> lines = List.of(
                "SGK Belgesi",
                "Dosya boyutu nedeniyle sıkıştırıldı",
                "Orijinal belge işlendi",
                "Yükleme tarihi: " + LocalDateTime.now(clock).format(DISPLAY_TIME),
                "Dosya: " + fileName);
        try {
            return new PackagedDocument(writer.writePlaceholder(lines), fileName, attempts, true);
        } catch (IOException ex) {
            log.error("Unable to write placeholder for {}", fileName, ex);
            throw new IllegalStateException("Unable to write placeholder document for " + fileName, ex);
        }
    }

    private String footer(PackagingRequest request, String fileName) {
        String patient = request.patientName() == null || request.patientName().isBlank()
                ? "Bilinmiyor"
                : request.patientName();
        return "Tarih: " + LocalDateTime.now(clock).format(DISPLAY_TIME)
                + " | Hasta: " + patient
                + " | Dosya: " + fileName;
    }
}
