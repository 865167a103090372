package com.example.sgkdocumentreader.service.packaging;

import com.example.sgkdocumentreader.util.TextNormalizer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Writes single-page A4 documents: either one JPEG-compressed page image with
 * a small footer, or a text-only placeholder page.
 */
@Component
public class PdfDocumentWriter {

    private static final float POINTS_PER_MM = 72f / 25.4f;
    private static final float MARGIN = 10 * POINTS_PER_MM;
    private static final float FOOTER_FONT_SIZE = 8f;
    private static final float FOOTER_HEIGHT = 12f;
    private static final float PLACEHOLDER_FONT_SIZE = 14f;
    private static final float PLACEHOLDER_LEADING = 22f;
    private static final String CREATOR = "SGK Document Reader";

    public byte[] writeImagePage(BufferedImage image, float jpegQuality, String footer) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            PDImageXObject pageImage = JPEGFactory.createFromImage(document, image, jpegQuality);

            PDRectangle box = page.getMediaBox();
            float availableWidth = box.getWidth() - 2 * MARGIN;
            float availableHeight = box.getHeight() - 2 * MARGIN - FOOTER_HEIGHT;
            float scale = Math.min(availableWidth / image.getWidth(), availableHeight / image.getHeight());
            float drawWidth = image.getWidth() * scale;
            float drawHeight = image.getHeight() * scale;
            float x = (box.getWidth() - drawWidth) / 2;
            float y = MARGIN + FOOTER_HEIGHT + (availableHeight - drawHeight) / 2;

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(pageImage, x, y, drawWidth, drawHeight);
                if (footer != null && !footer.isBlank()) {
                    content.beginText();
                    content.setFont(font(), FOOTER_FONT_SIZE);
                    content.newLineAtOffset(MARGIN, MARGIN);
                    content.showText(toPdfText(footer));
                    content.endText();
                }
            }
            describe(document, footer);
            return save(document);
        }
    }

    public byte[] writePlaceholder(List<String> lines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            PDRectangle box = page.getMediaBox();
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(font(), PLACEHOLDER_FONT_SIZE);
                content.setLeading(PLACEHOLDER_LEADING);
                content.newLineAtOffset(MARGIN * 2, box.getHeight() / 2 + PLACEHOLDER_LEADING * lines.size() / 2);
                for (String line : lines) {
                    content.showText(toPdfText(line));
                    content.newLine();
                }
                content.endText();
            }
            describe(document, lines.isEmpty() ? null : lines.get(0));
            return save(document);
        }
    }

    /** Standard 14 fonts only cover WinAnsi, so Turkish letters are folded first. */
    static String toPdfText(String text) {
        String folded = TextNormalizer.foldTurkish(text);
        StringBuilder builder = new StringBuilder(folded.length());
        for (char c : folded.toCharArray()) {
            builder.append(c >= 0x20 && c < 0x7f ? c : '?');
        }
        return builder.toString();
    }

    private static PDType1Font font() {
        return new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    }

    private static void describe(PDDocument document, String subject) {
        PDDocumentInformation information = document.getDocumentInformation();
        information.setCreator(CREATOR);
        information.setTitle("SGK Belgesi");
        if (subject != null) {
            information.setSubject(toPdfText(subject));
        }
    }

    private static byte[] save(PDDocument document) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        document.save(output);
        return output.toByteArray();
    }
}
