package com.labelcheck.backend.controllers;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.labelcheck.backend.dto.ApiResponse;
import com.labelcheck.backend.services.labels.LabelCheckService;
import com.labelcheck.backend.services.labels.classification.ClassificationResult;
import com.labelcheck.backend.services.labels.pipeline.BatchExtraction;
import com.labelcheck.backend.services.labels.reconciliation.ValidationReport;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/labels")
@RequiredArgsConstructor
public class LabelController {

    private final LabelCheckService labelCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<Map<String, String>>> health() {
        return ResponseEntity.ok(ApiResponse.success(Map.of("status", "ok"), "OK"));
    }

    @PostMapping(value = "/classify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ClassificationResult>> classify(@RequestParam("file") MultipartFile file) {
        ClassificationResult result = labelCheckService.classify(file);
        return ResponseEntity.ok(ApiResponse.success(result, "Documento classificado"));
    }

    @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<BatchExtraction>> extract(@RequestParam("files") List<MultipartFile> files) {
        BatchExtraction result = labelCheckService.extract(files);
        return ResponseEntity.ok(ApiResponse.success(result, "Etiquetas extraídas"));
    }

    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ValidationReport>> validate(
            @RequestParam("spreadsheet") MultipartFile spreadsheet,
            @RequestParam("files") List<MultipartFile> files
    ) {
        ValidationReport report = labelCheckService.validate(spreadsheet, files);
        return ResponseEntity.ok(ApiResponse.success(report, "Validação concluída"));
    }
}
