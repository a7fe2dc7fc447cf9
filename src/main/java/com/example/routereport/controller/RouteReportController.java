package com.example.routereport.controller;

import com.example.routereport.model.OutlineEntry;
import com.example.routereport.model.ReportLayout;
import com.example.routereport.model.ReportRequest;
import com.example.routereport.service.ReportDocumentService;
import com.example.routereport.util.ReportRequestException;
import com.example.routereport.util.ReportRequestParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Route report rendering endpoints.
 */
@RestController
@RequestMapping("/api/report")
@CrossOrigin(origins = "*")
public class RouteReportController {

    private static final Logger logger = LoggerFactory.getLogger(RouteReportController.class);

    @Value("${report.request.max-sections:200}")
    private int maxSections = 200;

    @Autowired
    private ReportDocumentService reportService;

    @Autowired
    private ReportRequestParser requestParser;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * Renders the submitted report and returns it as a PDF attachment.
     * @param body report request JSON
     */
    @PostMapping(value = "/render", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderReport(@RequestBody String body) {
        long startTime = System.currentTimeMillis();

        try {
            ReportRequest request = requestParser.parse(body);
            ValidationResult validation = validateRequest(request);
            if (!validation.isValid()) {
                logger.warn("Report validation failed: {}", validation.getMessage());
                return ResponseEntity.badRequest()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(createErrorResponse(validation.getMessage()));
            }

            logger.info("Rendering report '{}' with {} sections", request.getTitle(), request.getSections().size());
            byte[] pdf = reportService.renderReport(request);

            long duration = System.currentTimeMillis() - startTime;
            logger.info("Report rendered in {} ms, {} bytes", duration, pdf.length);

            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename*=UTF-8''" + encodeFilename(generateOutputFilename(request.getTitle())))
                    .header("X-Processing-Time-Ms", String.valueOf(duration))
                    .contentType(MediaType.APPLICATION_PDF)
                    .body(pdf);

        } catch (ReportRequestException e) {
            logger.warn("Rejected report request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse(e.getMessage()));
        } catch (IOException e) {
            logger.error("IO error rendering report: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("Report rendering failed: " + e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error rendering report: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("System error: " + e.getMessage()));
        }
    }

    /**
     * Lays the report out without returning the document: page count and the
     * page each section and table starts on.
     */
    @PostMapping(value = "/preview-layout", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> previewLayout(@RequestBody String body) {
        long startTime = System.currentTimeMillis();

        try {
            ReportRequest request = requestParser.parse(body);
            ValidationResult validation = validateRequest(request);
            if (!validation.isValid()) {
                logger.warn("Report validation failed: {}", validation.getMessage());
                return ResponseEntity.badRequest()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(createErrorResponse(validation.getMessage()));
            }

            ReportLayout layout = reportService.previewLayout(request);
            long duration = System.currentTimeMillis() - startTime;

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("title", request.getTitle());
            response.put("totalPages", layout.getTotalPages());
            response.put("sections", formatOutline(layout.getOutline()));
            response.put("processingTimeMs", duration);

            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(response));

        } catch (ReportRequestException e) {
            logger.warn("Rejected report request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse(e.getMessage()));
        } catch (IOException e) {
            logger.error("IO error laying out report: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("Report layout failed: " + e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error laying out report: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("System error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "Route Report Service");
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new HashMap<>();
        info.put("serviceName", "Route Risk Report Renderer");
        info.put("outputFormat", "PDF");
        info.put("maxSections", maxSections);
        info.put("cellTypes", new String[]{"text", "numeric", "link"});
        info.put("features", new String[]{
                "Word-wrapped table cells",
                "Repeated headers on continuation pages",
                "Clickable link cells",
                "Section bookmarks"
        });
        return ResponseEntity.ok(info);
    }

    // ========== Helpers ==========

    private ValidationResult validateRequest(ReportRequest request) {
        if (request.getSections().size() > maxSections) {
            return ValidationResult.invalid(
                    String.format("Too many sections: %d, at most %d allowed", request.getSections().size(), maxSections));
        }
        return ValidationResult.valid();
    }

    private String generateOutputFilename(String title) {
        String base = title == null ? "" : title.trim().replaceAll("[\\\\/:*?\"<>|\\s]+", "_");
        if (base.isEmpty()) {
            return "route_report.pdf";
        }
        return base + ".pdf";
    }

    private String encodeFilename(String filename) {
        return URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private List<Map<String, Object>> formatOutline(List<OutlineEntry> entries) {
        return entries.stream().map(entry -> {
            Map<String, Object> map = new HashMap<>();
            map.put("title", entry.getTitle());
            map.put("page", entry.getPage());
            map.put("level", entry.getLevel());
            return map;
        }).collect(Collectors.toList());
    }

    private String createErrorResponse(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        error.put("timestamp", System.currentTimeMillis());

        try {
            return objectMapper.writeValueAsString(error);
        } catch (Exception e) {
            return "{\"success\":false,\"error\":\"" + message.replace("\"", "'") + "\"}";
        }
    }

    // ========== Inner classes ==========

    private static class ValidationResult {
        private final boolean valid;
        private final String message;

        private ValidationResult(boolean valid, String message) {
            this.valid = valid;
            this.message = message;
        }

        public static ValidationResult valid() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult invalid(String message) {
            return new ValidationResult(false, message);
        }

        public boolean isValid() {
            return valid;
        }

        public String getMessage() {
            return message;
        }
    }
}
