package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.UploadedFile;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Turns an accepted upload into the raster the pipeline works on. PDFs
 * contribute their first page only.
 */
@Component
public class PageImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(PageImageDecoder.class);

    private static final String UNREADABLE = "The file could not be read as an image or PDF";

    private final float pdfRenderDpi;

    public PageImageDecoder(PipelineProperties properties) {
        this.pdfRenderDpi = properties.getUpload().getPdfRenderDpi();
    }

    public BufferedImage decode(UploadedFile file, String mediaType) {
        try {
            BufferedImage image = "application/pdf".equals(mediaType) ? renderFirstPage(file) : readImage(file);
            if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
                throw new ValidationException("No decodable image in " + file.fileName(), UNREADABLE);
            }
            return image;
        } catch (IOException ex) {
            log.warn("Failed to decode {}: {}", file.fileName(), ex.getMessage());
            throw new ValidationException("Failed to decode " + file.fileName(), UNREADABLE, ex);
        }
    }

    private BufferedImage readImage(UploadedFile file) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(file.content()));
    }

    private BufferedImage renderFirstPage(UploadedFile file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.content())) {
            if (document.getNumberOfPages() == 0) {
                throw new ValidationException("PDF without pages: " + file.fileName(), UNREADABLE);
            }
            if (document.getNumberOfPages() > 1) {
                log.info("{} has {} pages, processing the first one", file.fileName(), document.getNumberOfPages());
            }
            return new PDFRenderer(document).renderImageWithDPI(0, pdfRenderDpi, ImageType.RGB);
        }
    }
}
