package com.example.statement.interfaces.api;

import com.example.statement.application.service.CsvExportService;
import com.example.statement.application.service.StatementProcessingService;
import com.example.statement.domain.model.BankDetectionResult;
import com.example.statement.domain.model.StatementBatchResult;
import com.example.statement.domain.model.StatementDetectionEntry;
import com.example.statement.domain.model.StatementProcessingResult;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer REST controller for bank detection, statement processing and CSV export.
 */
@RestController
@RequestMapping("/api/statements")
public class StatementController {

    static final String SESSION_RESULT_KEY = "LATEST_STATEMENT_RESULT";

    private final StatementProcessingService processingService;
    private final CsvExportService csvExportService;

    public StatementController(StatementProcessingService processingService, CsvExportService csvExportService) {
        this.processingService = processingService;
        this.csvExportService = csvExportService;
    }

    /**
     * Identifies the issuing bank of an uploaded statement.
     *
     * @param file uploaded PDF
     * @return detection result
     */
    @PostMapping(value = "/detect", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BankDetectionResult> detect(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(processingService.detect(file));
    }

    /**
     * Processes an uploaded statement and caches the result for a later export.
     *
     * @param file    uploaded PDF
     * @param bank    parser to use instead of detecting the bank (optional)
     * @param session HTTP session caching the result
     * @return normalized transactions
     */
    @PostMapping(value = "/process", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatementProcessingResult> process(@RequestParam("file") MultipartFile file,
                                                             @RequestParam(value = "bank", required = false) String bank,
                                                             HttpSession session) {
        StatementProcessingResult result = processingService.process(file, bank);
        session.setAttribute(SESSION_RESULT_KEY, result);
        return ResponseEntity.ok(result);
    }

    /**
     * Identifies the issuing bank of each uploaded statement.
     *
     * @param files uploaded PDFs
     * @return one detection entry per file
     */
    @PostMapping(value = "/batch/detect", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<StatementDetectionEntry>> detectBatch(
            @RequestParam(value = "file", required = false) List<MultipartFile> files) {
        return ResponseEntity.ok(processingService.detectBatch(files));
    }

    /**
     * Processes several statements and caches their combined transactions for a later export.
     *
     * @param files   uploaded PDFs
     * @param bank    parser to use for every file instead of detecting the bank (optional)
     * @param session HTTP session caching the combined result
     * @return per-file status and summary
     */
    @PostMapping(value = "/batch/process", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatementBatchResult> processBatch(
            @RequestParam(value = "file", required = false) List<MultipartFile> files,
            @RequestParam(value = "bank", required = false) String bank,
            HttpSession session) {
        StatementBatchResult result = processingService.processBatch(files, bank);
        session.setAttribute(SESSION_RESULT_KEY, result.combined());
        return ResponseEntity.ok(result);
    }

    /**
     * Streams the selected transactions of the cached result as CSV.
     *
     * @param rowIds  1-based positions of the transactions to export
     * @param session HTTP session holding the cached result
     * @return CSV document
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(@RequestParam(name = "rowIds", required = false) List<Integer> rowIds,
                                            HttpSession session) {
        String csv = csvExportService.exportSelectedRows(cachedResult(session), rowIds);
        return csvResponse(csv);
    }

    /**
     * Streams every transaction of the cached result as CSV.
     *
     * @param session HTTP session holding the cached result
     * @return CSV document
     */
    @PostMapping("/export/all")
    public ResponseEntity<byte[]> exportAllCsv(HttpSession session) {
        return csvResponse(csvExportService.exportAll(cachedResult(session)));
    }

    @GetMapping(value = "/banks", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> supportedBanks() {
        return processingService.supportedBanks();
    }

    private StatementProcessingResult cachedResult(HttpSession session) {
        return (StatementProcessingResult) session.getAttribute(SESSION_RESULT_KEY);
    }

    private ResponseEntity<byte[]> csvResponse(String csv) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"transactions.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
