package com.example.txanalyzer.interfaces.api;

import com.example.txanalyzer.application.service.CsvExportService;
import com.example.txanalyzer.application.service.TransactionAnalysisService;
import com.example.txanalyzer.application.service.TransactionCategorizer;
import com.example.txanalyzer.domain.model.AnalysisReport;
import com.example.txanalyzer.domain.model.CategoryMatch;
import com.example.txanalyzer.domain.model.TransactionSet;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer controller that accepts CSV transaction exports and returns summaries or a categorized CSV.
 */
@Controller
public class TransactionAnalysisController {

    private final TransactionAnalysisService analysisService;
    private final TransactionCategorizer categorizer;
    private final CsvExportService csvExportService;

    /**
     * Creates the controller with the required application services.
     *
     * @param analysisService  service running the whole pipeline
     * @param categorizer      categorizer exposing the configured keyword table
     * @param csvExportService service responsible for CSV generation
     */
    public TransactionAnalysisController(TransactionAnalysisService analysisService,
                                         TransactionCategorizer categorizer,
                                         CsvExportService csvExportService) {
        this.analysisService = analysisService;
        this.categorizer = categorizer;
        this.csvExportService = csvExportService;
    }

    /**
     * Runs the full pipeline over an uploaded export.
     *
     * @param file uploaded CSV with Date, Description and Amount columns
     * @return JSON report; {@code overall} is {@code null} when no row survived cleaning
     */
    @PostMapping(value = "/api/analyze", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<AnalysisReport> analyze(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(analysisService.analyze(file));
    }

    /**
     * Cleans and categorizes an uploaded export and streams it back as CSV.
     *
     * @param file uploaded CSV
     * @return categorized CSV document
     */
    @PostMapping("/api/categorize/export")
    public ResponseEntity<byte[]> exportCategorized(@RequestParam("file") MultipartFile file) {
        TransactionSet categorized = analysisService.categorize(file);
        String csv = csvExportService.exportTransactions(categorized);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"categorized-transactions.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping(value = "/api/categories", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public Map<String, List<String>> categories() {
        return categorizer.getKeywordTable().asMap();
    }

    /**
     * Shows which category a description would get and why.
     *
     * @param description description to test
     * @return chosen category and matching keyword
     */
    @GetMapping(value = "/api/categories/match", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public CategoryMatch match(@RequestParam("description") String description) {
        return categorizer.explain(description);
    }
}
