package com.labelcheck.backend.services.labels;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.InputStream;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import com.labelcheck.backend.exceptions.BadRequestException;
import com.labelcheck.backend.services.labels.layout.LabelItem;
import com.labelcheck.backend.services.labels.pipeline.BatchExtraction;
import com.labelcheck.backend.services.labels.pipeline.LabelExtractionPipeline;
import com.labelcheck.backend.services.labels.reconciliation.ExpectedRow;
import com.labelcheck.backend.services.labels.reconciliation.ReconciliationService;
import com.labelcheck.backend.services.labels.reconciliation.ValidationReport;
import com.labelcheck.backend.services.labels.spreadsheet.ExpectedRowReader;

@ExtendWith(MockitoExtension.class)
class LabelCheckServiceTest {

    @Mock
    private LabelExtractionPipeline extractionPipeline;

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private ExpectedRowReader expectedRowReader;

    @InjectMocks
    private LabelCheckService labelCheckService;

    private static MockMultipartFile pdf(String name, byte[] bytes) {
        return new MockMultipartFile("files", name, "application/pdf", bytes);
    }

    private static MockMultipartFile spreadsheet() {
        return new MockMultipartFile("spreadsheet", "expected.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", new byte[] { 1 });
    }

    @Test
    void extract_nonPdfContentType_isRejected() {
        MockMultipartFile text = new MockMultipartFile("files", "notes.txt", "text/plain", new byte[] { 1 });

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> labelCheckService.extract(List.of(text)));

        assertEquals("Arquivo não suportado: notes.txt", ex.getMessage());
        verifyNoInteractions(extractionPipeline);
    }

    @Test
    void extract_noFiles_isRejected() {
        assertThrows(BadRequestException.class, () -> labelCheckService.extract(List.of()));
        assertThrows(BadRequestException.class, () -> labelCheckService.extract(null));
        verifyNoInteractions(extractionPipeline);
    }

    @Test
    void extract_emptyFile_isRejected() {
        MultipartFile empty = pdf("empty.pdf", new byte[0]);

        assertThrows(BadRequestException.class, () -> labelCheckService.extract(List.of(empty)));
        verifyNoInteractions(extractionPipeline);
    }

    @Test
    @SuppressWarnings("unchecked")
    void extract_passesEveryPdfInUploadOrder() {
        BatchExtraction batch = new BatchExtraction(List.of(), List.of());
        when(extractionPipeline.extractBatch(anyList())).thenReturn(batch);

        BatchExtraction result = labelCheckService.extract(List.of(
                pdf("a.pdf", new byte[] { 1, 2 }),
                pdf("b.pdf", new byte[] { 3 })));

        assertSame(batch, result);
        ArgumentCaptor<List<byte[]>> captor = ArgumentCaptor.forClass(List.class);
        verify(extractionPipeline).extractBatch(captor.capture());
        assertEquals(2, captor.getValue().size());
        assertArrayEquals(new byte[] { 1, 2 }, captor.getValue().get(0));
        assertArrayEquals(new byte[] { 3 }, captor.getValue().get(1));
    }

    @Test
    void validate_missingSpreadsheet_isRejected() {
        assertThrows(BadRequestException.class,
                () -> labelCheckService.validate(null, List.of(pdf("a.pdf", new byte[] { 1 }))));
        verifyNoInteractions(expectedRowReader, extractionPipeline, reconciliationService);
    }

    @Test
    void validate_reconcilesRowsAgainstPooledItems() {
        List<ExpectedRow> rows = List.of(new ExpectedRow("AV1001DR2", "L", "", "036000291452", ""));
        List<LabelItem> care = List.of(LabelItem.builder().page(1).position(3).build());
        List<LabelItem> hang = List.of();
        ValidationReport report = ValidationReport.of(List.of());

        when(expectedRowReader.read(any(InputStream.class))).thenReturn(rows);
        when(extractionPipeline.extractBatch(anyList())).thenReturn(new BatchExtraction(care, hang));
        when(reconciliationService.reconcile(rows, care, hang)).thenReturn(report);

        ValidationReport result = labelCheckService.validate(spreadsheet(), List.of(pdf("a.pdf", new byte[] { 1 })));

        assertSame(report, result);
    }
}
