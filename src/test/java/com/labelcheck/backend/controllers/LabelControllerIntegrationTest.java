package com.labelcheck.backend.controllers;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.ByteArrayOutputStream;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.labelcheck.backend.services.labels.pipeline.SampleSheets;

@SpringBootTest(properties = {
        "labelcheck.ocr.enabled=false",
        "labelcheck.barcode.enabled=false"
})
@AutoConfigureMockMvc
class LabelControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private static MockMultipartFile pdf(String name, byte[] bytes) {
        return new MockMultipartFile("files", name, "application/pdf", bytes);
    }

    private static byte[] expectedRows() throws Exception {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("PO");
            Row header = sheet.createRow(0);
            String[] headers = { "Style #", "Size", "Color", "Care Label UPC", "Hang Tag UPC" };
            for (int i = 0; i < headers.length; i++) {
                header.createCell(i).setCellValue(headers[i]);
            }
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("AV1001DR2");
            row.createCell(1).setCellValue("L");
            row.createCell(2).setCellValue("Black Soot");
            row.createCell(3).setCellValue("036000291452");
            row.createCell(4).setCellValue("036000291453");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            wb.write(out);
            return out.toByteArray();
        }
    }

    @Test
    void extract_careAndHangTagSheets() throws Exception {
        mockMvc.perform(multipart("/api/labels/extract")
                        .file(pdf("care.pdf", SampleSheets.careSheet()))
                        .file(pdf("hang.pdf", SampleSheets.hangTagSheet())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.care_labels.length()").value(6))
                .andExpect(jsonPath("$.data.care_labels[2].position").value(3))
                .andExpect(jsonPath("$.data.care_labels[2].size").value("L"))
                .andExpect(jsonPath("$.data.care_labels[2].upc").value("036000291452"))
                .andExpect(jsonPath("$.data.care_labels[2].style_number").value("AV1001DR2"))
                .andExpect(jsonPath("$.data.care_labels[2].match_upc").value("036000291452"))
                .andExpect(jsonPath("$.data.hang_tags.length()").value(7))
                .andExpect(jsonPath("$.data.hang_tags[1].upc_candidate").value("036000291453"))
                .andExpect(jsonPath("$.data.hang_tags[1].color").value("SALSA DELIGHT"));
    }

    @Test
    void validate_reconcilesSpreadsheetAgainstSheets() throws Exception {
        MockMultipartFile spreadsheet = new MockMultipartFile(
                "spreadsheet", "expected.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", expectedRows());

        mockMvc.perform(multipart("/api/labels/validate")
                        .file(spreadsheet)
                        .file(pdf("care.pdf", SampleSheets.careSheet()))
                        .file(pdf("hang.pdf", SampleSheets.hangTagSheet())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.summary.rows").value(1))
                .andExpect(jsonPath("$.data.summary.care_label_matches").value(1))
                .andExpect(jsonPath("$.data.summary.hang_tag_matches").value(0))
                .andExpect(jsonPath("$.data.results[0].care_label.match").value("style+size+color"))
                .andExpect(jsonPath("$.data.results[0].care_label.upc_matches").value(true))
                .andExpect(jsonPath("$.data.results[0].hang_tag.match").value("none"))
                .andExpect(jsonPath("$.data.results[0].hang_tag.upc_matches").value(false));
    }

    @Test
    void extract_nonPdfUpload_returns400() throws Exception {
        MockMultipartFile text = new MockMultipartFile("files", "notes.txt", "text/plain", "hello".getBytes());

        mockMvc.perform(multipart("/api/labels/extract").file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void classify_corruptPdf_returns422() throws Exception {
        MockMultipartFile corrupt = new MockMultipartFile("file", "broken.pdf", "application/pdf", "not a pdf".getBytes());

        mockMvc.perform(multipart("/api/labels/classify").file(corrupt))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));
    }
}
