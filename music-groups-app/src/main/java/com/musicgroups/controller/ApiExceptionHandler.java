package com.musicgroups.controller;

import com.musicgroups.edit.SaveIncompleteException;
import com.musicgroups.service.ConflictException;
import com.musicgroups.service.InvalidPayloadException;
import com.musicgroups.service.NotFoundException;
import com.musicgroups.service.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SaveIncompleteException.class)
    public ResponseEntity<Map<String, Object>> saveIncomplete(SaveIncompleteException e) {
        Map<String, Object> body = error("save_incomplete", e.getMessage());
        body.put("groupId", e.getGroupId());
        body.put("phase", e.getPhase());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler({NotFoundException.class, NoSuchElementException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", e.getMessage()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> conflict(ConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error("conflict", e.getMessage()));
    }

    @ExceptionHandler({InvalidPayloadException.class, IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(error("bad_request", e.getMessage()));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, Object>> unavailable(PersistenceException e) {
        log.error("Backend call failed", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error("unavailable", e.getMessage()));
    }

    private static Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
