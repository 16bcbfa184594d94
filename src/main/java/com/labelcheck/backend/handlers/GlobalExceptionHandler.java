package com.labelcheck.backend.handlers;

import com.labelcheck.backend.dto.ApiResponse;
import com.labelcheck.backend.exceptions.BadRequestException;
import com.labelcheck.backend.services.labels.pipeline.LabelExtractionException;
import com.labelcheck.backend.services.labels.spreadsheet.SpreadsheetReadException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String message,
            List<String> errors
    ) {
        return ResponseEntity.status(status).body(ApiResponse.error(message, errors));
    }

    // 400 – requisição inválida (arquivo ausente, tipo não suportado)
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(BadRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 – parte multipart ausente
    @ExceptionHandler({ MissingServletRequestPartException.class, MissingServletRequestParameterException.class })
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(Exception ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Arquivo ausente", List.of(ex.getMessage()));
    }

    // 413 – upload acima do limite
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUpload(MaxUploadSizeExceededException ex) {
        return buildResponse(HttpStatus.PAYLOAD_TOO_LARGE, "Arquivo muito grande", List.of(ex.getMessage()));
    }

    // 422 – PDF que não abre
    @ExceptionHandler(LabelExtractionException.class)
    public ResponseEntity<ApiResponse<Void>> handleLabelExtraction(LabelExtractionException ex) {
        log.warn("[LabelExtraction] Rejected document: {}", ex.getMessage());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), List.of(ex.getMessage()));
    }

    // 422 – planilha ilegível
    @ExceptionHandler(SpreadsheetReadException.class)
    public ResponseEntity<ApiResponse<Void>> handleSpreadsheet(SpreadsheetReadException ex) {
        log.warn("[Reconcile] Rejected spreadsheet: {}", ex.getMessage());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), List.of(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "Requisição inválida";
        }
        return buildResponse(HttpStatus.BAD_REQUEST, msg, List.of());
    }

    // 500 – erro inesperado
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Erro inesperado", ex);
        return buildResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Erro interno no servidor",
                List.of(String.valueOf(ex.getMessage()))
        );
    }
}
