package com.example.sgkdocumentreader.service.packaging;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfDocumentWriterTest {

    private final PdfDocumentWriter writer = new PdfDocumentWriter();

    @Test
    void shouldWriteSinglePageWithFooter() throws Exception {
        BufferedImage image = new BufferedImage(300, 400, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 300, 400);
        g.dispose();

        byte[] pdf = writer.writeImagePage(image, 0.9f, "Hasta: Ayşe Demir");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            assertThat(document.getDocumentInformation().getCreator()).isEqualTo("SGK Document Reader");
            assertThat(new PDFTextStripper().getText(document)).contains("Hasta: Ayse Demir");
        }
    }

    @Test
    void shouldWritePlaceholderLines() throws Exception {
        byte[] pdf = writer.writePlaceholder(List.of("SGK Belgesi", "Dosya boyutu nedeniyle sıkıştırıldı"));

        try (PDDocument document = Loader.loadPDF(pdf)) {
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("SGK Belgesi").contains("Dosya boyutu nedeniyle sikistirildi");
        }
    }

    @Test
    void shouldFoldTextToWinAnsiSafeCharacters() {
        assertThat(PdfDocumentWriter.toPdfText("Işık €5")).isEqualTo("Isik ?5");
    }
}
