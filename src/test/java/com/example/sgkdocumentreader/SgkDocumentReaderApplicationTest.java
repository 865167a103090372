package com.example.sgkdocumentreader;

import com.example.sgkdocumentreader.service.ocr.OcrEngine;
import com.example.sgkdocumentreader.service.ocr.OcrResult;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SgkDocumentReaderApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OcrEngine ocrEngine;

    @Test
    void uploadedPrescriptionIsFiledUnderMatchedPatient() throws Exception {
        when(ocrEngine.extractText(any())).thenReturn(new OcrResult("AHMET YILMAZ\nTC: 12345678950\nReçete", 0.88));

        BufferedImage page = new BufferedImage(600, 800, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = page.createGraphics();
        try {
            graphics.setColor(Color.DARK_GRAY);
            graphics.fillRect(0, 0, 600, 800);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(60, 80, 480, 640);
            graphics.setColor(Color.BLACK);
            graphics.drawString("AHMET YILMAZ", 100, 140);
            graphics.drawString("TC: 12345678950", 100, 170);
            graphics.drawString("Reçete", 100, 200);
        } finally {
            graphics.dispose();
        }
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        ImageIO.write(page, "png", outputStream);
        MockMultipartFile scan = new MockMultipartFile("file", "scan.png", MediaType.IMAGE_PNG_VALUE,
                outputStream.toByteArray());

        MvcResult upload = mockMvc.perform(multipart("/api/v1/documents/upload").file(scan).param("runId", "e2e-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoAssigned").value(true))
                .andExpect(jsonPath("$.identity.tier").value("HIGH"))
                .andExpect(jsonPath("$.artifact.patientId").value("p-1001"))
                .andExpect(jsonPath("$.artifact.documentType").value("PRESCRIPTION"))
                .andExpect(jsonPath("$.artifact.fileName", startsWith("AHMET_YILMAZ_Recete_")))
                .andReturn();
        String artifactId = JsonPath.read(upload.getResponse().getContentAsString(), "$.artifact.id");

        mockMvc.perform(get("/api/v1/runs/e2e-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("DONE"))
                .andExpect(jsonPath("$.artifactId").value(artifactId));

        mockMvc.perform(get("/api/v1/documents/" + artifactId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workflowStatus").value("DOCUMENTS_UPLOADED"));

        MvcResult pdf = mockMvc.perform(get("/api/v1/documents/" + artifactId + "/content"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andReturn();
        byte[] body = pdf.getResponse().getContentAsByteArray();
        assertThat(body.length).isPositive().isLessThanOrEqualTo(300 * 1024);
        assertThat(new String(body, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");

        mockMvc.perform(get("/api/v1/patients/p-1001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStatus").value("DOCUMENTS_UPLOADED"))
                .andExpect(jsonPath("$.lastIdentityQuery.runId").value("e2e-1"));
    }
}
