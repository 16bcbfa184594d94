package com.labelcheck.backend.services.labels;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.labelcheck.backend.exceptions.BadRequestException;
import com.labelcheck.backend.services.labels.classification.ClassificationResult;
import com.labelcheck.backend.services.labels.pipeline.BatchExtraction;
import com.labelcheck.backend.services.labels.pipeline.LabelExtractionPipeline;
import com.labelcheck.backend.services.labels.reconciliation.ExpectedRow;
import com.labelcheck.backend.services.labels.reconciliation.ReconciliationService;
import com.labelcheck.backend.services.labels.reconciliation.ValidationReport;
import com.labelcheck.backend.services.labels.spreadsheet.ExpectedRowReader;
import com.labelcheck.backend.services.labels.spreadsheet.SpreadsheetReadException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Upload-facing entry points: checks the files and hands their bytes to the label pipeline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LabelCheckService {

    static final Set<String> PDF_CONTENT_TYPES = Set.of("application/pdf", "application/x-pdf");

    private final LabelExtractionPipeline extractionPipeline;
    private final ReconciliationService reconciliationService;
    private final ExpectedRowReader expectedRowReader;

    public ClassificationResult classify(MultipartFile file) {
        return extractionPipeline.classify(readPdf(file));
    }

    public BatchExtraction extract(List<MultipartFile> files) {
        return extractionPipeline.extractBatch(readPdfs(files));
    }

    public ValidationReport validate(MultipartFile spreadsheet, List<MultipartFile> files) {
        if (spreadsheet == null || spreadsheet.isEmpty()) {
            throw new BadRequestException("Planilha ausente ou vazia");
        }
        List<byte[]> pdfs = readPdfs(files);

        List<ExpectedRow> rows;
        try (InputStream in = spreadsheet.getInputStream()) {
            rows = expectedRowReader.read(in);
        } catch (IOException e) {
            throw new SpreadsheetReadException("Não foi possível ler a planilha: " + e.getMessage(), e);
        }

        BatchExtraction extraction = extractionPipeline.extractBatch(pdfs);
        log.info("[Reconcile] spreadsheet='{}' rows={} documents={}", spreadsheet.getOriginalFilename(), rows.size(), pdfs.size());
        return reconciliationService.reconcile(rows, extraction.careLabels(), extraction.hangTags());
    }

    private List<byte[]> readPdfs(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new BadRequestException("Nenhum arquivo enviado");
        }
        List<byte[]> pdfs = new ArrayList<>();
        for (MultipartFile file : files) {
            pdfs.add(readPdf(file));
        }
        return pdfs;
    }

    private byte[] readPdf(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("Arquivo ausente ou vazio");
        }
        if (!PDF_CONTENT_TYPES.contains(file.getContentType())) {
            throw new BadRequestException("Arquivo não suportado: " + file.getOriginalFilename());
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new BadRequestException("Não foi possível ler o arquivo: " + file.getOriginalFilename());
        }
    }
}
