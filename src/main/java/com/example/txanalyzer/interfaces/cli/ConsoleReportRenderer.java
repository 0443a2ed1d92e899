package com.example.txanalyzer.interfaces.cli;

import com.example.txanalyzer.domain.model.AnalysisReport;
import com.example.txanalyzer.domain.model.CategorySummary;
import com.example.txanalyzer.domain.model.CleaningReport;
import com.example.txanalyzer.domain.model.MonthlySummary;
import com.example.txanalyzer.domain.model.OverallSummary;
import com.example.txanalyzer.domain.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Renders an {@link AnalysisReport} as plain text for the command line.
 */
@Component
public class ConsoleReportRenderer {

    private static final String RULE = "-".repeat(48);

    public String render(AnalysisReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Transaction analysis: ").append(report.sourceName()).append('\n');
        out.append(RULE).append('\n');

        CleaningReport cleaning = report.cleaning();
        out.append(String.format(Locale.ROOT, "Rows read: %d, kept: %d, dropped: %d%n",
                cleaning.inputRows(), cleaning.keptRows(), cleaning.droppedRows()));

        if (report.overall().isEmpty()) {
            out.append("No valid transactions to summarize.\n");
            return out.toString();
        }

        OverallSummary overall = report.overall().get();
        out.append(String.format(Locale.ROOT, "Period:         %s to %s%n", overall.startDate(), overall.endDate()));
        out.append(String.format(Locale.ROOT, "Transactions:   %d%n", overall.count()));
        out.append(String.format(Locale.ROOT, "Total income:   %s%n", money(overall.totalIncome())));
        out.append(String.format(Locale.ROOT, "Total expenses: %s%n", money(overall.totalExpenses())));
        out.append(String.format(Locale.ROOT, "Net amount:     %s%n", money(overall.netAmount())));

        out.append('\n').append("By category").append('\n').append(RULE).append('\n');
        for (CategorySummary row : report.categories()) {
            out.append(String.format(Locale.ROOT, "%-24s %12s %5d%n", row.category(), money(row.totalAmount()), row.count()));
        }

        if (!report.monthly().isEmpty()) {
            out.append('\n').append("By month").append('\n').append(RULE).append('\n');
            for (MonthlySummary month : report.monthly()) {
                out.append(String.format(Locale.ROOT, "%-8s in %12s  out %12s  net %12s%n",
                        month.month(), money(month.income()), money(month.expenses()), money(month.net())));
            }
        }

        if (!report.topExpenses().isEmpty()) {
            out.append('\n').append("Largest expenses").append('\n').append(RULE).append('\n');
            for (TransactionRecord record : report.topExpenses()) {
                out.append(String.format(Locale.ROOT, "%s  %12s  %s%n", record.date(), money(record.amount()), record.description()));
            }
        }
        return out.toString();
    }

    private String money(BigDecimal value) {
        return String.format(Locale.ROOT, "%,.2f", value);
    }
}
