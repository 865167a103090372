package com.example.sgkdocumentreader.service.ocr;

import com.example.sgkdocumentreader.exception.ExtractionFailureException;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TesseractOcrEngineTest {

    private final ITesseract tesseract = mock(ITesseract.class);
    private final TesseractOcrEngine engine = new TesseractOcrEngine(tesseract);

    @Test
    void shouldReturnTrimmedTextAndMeanWordConfidence() throws Exception {
        when(tesseract.doOCR(any(BufferedImage.class))).thenReturn("  ALİ VELİ\n");
        when(tesseract.getWords(any(BufferedImage.class), eq(ITessAPI.TessPageIteratorLevel.RIL_WORD)))
                .thenReturn(List.of(new Word("ALİ", 80f, new Rectangle()), new Word("VELİ", 90f, new Rectangle())));

        OcrResult result = engine.extractText(png());

        assertThat(result.text()).isEqualTo("ALİ VELİ");
        assertThat(result.confidence()).isCloseTo(0.85, within(1e-6));
    }

    @Test
    void shouldReportZeroConfidenceWhenWordsAreUnavailable() throws Exception {
        when(tesseract.doOCR(any(BufferedImage.class))).thenReturn("text");
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenThrow(new IllegalStateException("no words"));

        assertThat(engine.extractText(png()).confidence()).isZero();
    }

    @Test
    void shouldWrapTesseractFailures() throws Exception {
        when(tesseract.doOCR(any(BufferedImage.class))).thenThrow(new TesseractException("engine crashed"));

        assertThatThrownBy(() -> engine.extractText(png()))
                .isInstanceOf(ExtractionFailureException.class)
                .hasMessageContaining("engine crashed");
    }

    @Test
    void shouldRejectUndecodableInput() {
        assertThatThrownBy(() -> engine.extractText("not an image".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ExtractionFailureException.class);
    }

    @Test
    void disabledEngineShouldAlwaysFail() {
        assertThatThrownBy(() -> new DisabledOcrEngine().extractText(new byte[0]))
                .isInstanceOf(ExtractionFailureException.class)
                .hasMessageContaining("disabled");
    }

    private static byte[] png() throws IOException {
        BufferedImage image = new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(image, "png", output);
        return output.toByteArray();
    }
}
