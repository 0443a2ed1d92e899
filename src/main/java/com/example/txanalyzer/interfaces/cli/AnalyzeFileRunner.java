package com.example.txanalyzer.interfaces.cli;

import com.example.txanalyzer.application.service.TransactionAnalysisService;
import com.example.txanalyzer.domain.model.AnalysisReport;
import com.example.txanalyzer.infrastructure.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Analyzes {@code analyzer.input-file} once at startup and prints the report.
 * Fatal pipeline errors are logged and rethrown so the application exits without a partial report.
 */
@Component
@ConditionalOnProperty(prefix = "analyzer", name = "input-file")
public class AnalyzeFileRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeFileRunner.class);

    private final TransactionAnalysisService analysisService;
    private final ConsoleReportRenderer renderer;
    private final AnalyzerProperties properties;
    private final PrintStream out;

    @Autowired
    public AnalyzeFileRunner(TransactionAnalysisService analysisService,
                             ConsoleReportRenderer renderer,
                             AnalyzerProperties properties) {
        this(analysisService, renderer, properties, System.out);
    }

    AnalyzeFileRunner(TransactionAnalysisService analysisService,
                      ConsoleReportRenderer renderer,
                      AnalyzerProperties properties,
                      PrintStream out) {
        this.analysisService = analysisService;
        this.renderer = renderer;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        Path input = Path.of(properties.getInputFile());
        log.info("Analyzing {}", input.toAbsolutePath());
        try {
            AnalysisReport report = analysisService.analyze(input);
            out.print(renderer.render(report));
            out.flush();
        } catch (RuntimeException ex) {
            log.error("Analysis of {} failed: {}", input, ex.getMessage());
            throw ex;
        }
    }
}
