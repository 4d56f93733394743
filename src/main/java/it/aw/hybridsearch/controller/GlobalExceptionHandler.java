package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.exception.EmbeddingFailureException;
import it.aw.hybridsearch.exception.IncompatibleEmbeddingException;
import it.aw.hybridsearch.exception.RerankFailureException;
import it.aw.hybridsearch.exception.SearchPipelineException;
import it.aw.hybridsearch.exception.UnsupportedDocumentException;
import it.aw.hybridsearch.exception.VectorStoreFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Traduce le eccezioni della pipeline in risposte JSON {@code {error, message, timestamp}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IncompatibleEmbeddingException.class)
    public ResponseEntity<Map<String, Object>> handleIncompatibleEmbedding(IncompatibleEmbeddingException ex) {
        log.warn("Dimensione embedding incompatibile: store {}, vettore {}", ex.expected(), ex.actual());
        return body(HttpStatus.CONFLICT, ex.kind(), ex.getMessage());
    }

    @ExceptionHandler(UnsupportedDocumentException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedDocument(UnsupportedDocumentException ex) {
        return body(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ex.kind(), ex.getMessage());
    }

    @ExceptionHandler({EmbeddingFailureException.class, VectorStoreFailureException.class,
                       RerankFailureException.class})
    public ResponseEntity<Map<String, Object>> handleCollaboratorFailure(SearchPipelineException ex) {
        log.error("Errore del collaboratore esterno [{}]: {}", ex.kind(), ex.getMessage(), ex);
        return body(HttpStatus.BAD_GATEWAY, ex.kind(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "IllegalArgument", ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "BadParameter", ex.getMessage());
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<Map<String, Object>> handleCancellation(CancellationException ex) {
        log.warn("Operazione cancellata: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Cancelled", ex.getMessage());
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(IOException ex) {
        log.error("Errore di lettura del documento: {}", ex.getMessage(), ex);
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "UnreadableDocument", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Errore inatteso", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                ex.getMessage() != null ? ex.getMessage() : "Errore inatteso");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
