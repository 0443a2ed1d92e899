package com.example.txanalyzer.application.service;

import com.example.txanalyzer.domain.model.CleaningReport;
import com.example.txanalyzer.domain.model.CleaningResult;
import com.example.txanalyzer.domain.model.PipelineStage;
import com.example.txanalyzer.domain.model.RawRecord;
import com.example.txanalyzer.domain.model.TransactionRecord;
import com.example.txanalyzer.domain.model.TransactionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Second pipeline stage: coerces dates and amounts, trims descriptions and drops rows whose date or amount
 * cannot be recovered. Dropped rows are counted in a {@link CleaningReport}, never raised.
 * <p>
 * Numeric dates are read month first ({@code 01/05/2024} is 5 January 2024); dotted dates are read day first.
 * Two-digit years fall in 1950-2049.
 */
@Service
public class TransactionCleaner {

    private static final Logger log = LoggerFactory.getLogger(TransactionCleaner.class);

    // characters dropped from amount text before parsing: $ € £ ¥ ₹, whitespace, thousands separators
    private static final Pattern AMOUNT_NOISE = Pattern.compile("[$\\u20AC\\u00A3\\u00A5\\u20B9\\s\\u00A0,]");
    // plain decimals only; exponent notation is not an amount
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final int MAX_SCALE = 10;
    private static final int MAX_INTEGER_DIGITS = 15;
    private static final int TWO_DIGIT_YEAR_BASE = 1950;
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            pattern("uuuu-M-d"),
            pattern("uuuu/M/d"),
            pattern("M/d/uuuu"),
            twoDigitYear("M/d/"),
            pattern("M-d-uuuu"),
            pattern("d.M.uuuu"),
            pattern("uuuuMMdd"),
            pattern("d MMM uuuu"),
            pattern("d MMMM uuuu"),
            pattern("d-MMM-uuuu"),
            twoDigitYear("d-MMM-"),
            pattern("MMM d, uuuu"),
            pattern("MMMM d, uuuu"),
            pattern("MMM d uuuu"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            pattern("uuuu-MM-dd HH:mm[:ss]"),
            pattern("M/d/uuuu H:mm[:ss]")
    );

	/**
	 * Cleans a record set. Raw sets become {@code CLEANED}; sets that are already cleaned or categorized
	 * run through the same rules, which leave their values (and categories) untouched.
	 *
	 * @param transactions record set at any stage
	 * @return surviving records in their original order plus the drop diagnostic
	 */
    public CleaningResult clean(TransactionSet transactions) {
        List<TransactionRecord> kept = new ArrayList<>(transactions.size());
        int invalidDates = 0;
        int invalidAmounts = 0;

        if (transactions.stage() == PipelineStage.RAW) {
            for (RawRecord raw : transactions.rawRecords()) {
                LocalDate date = parseDate(raw.get(TransactionLoader.DATE_COLUMN));
                BigDecimal amount = parseAmount(raw.get(TransactionLoader.AMOUNT_COLUMN));
                if (date == null) {
                    invalidDates++;
                }
                if (amount == null) {
                    invalidAmounts++;
                }
                if (date == null || amount == null) {
                    log.debug("Dropping row {}: date={} amount={}", raw.rowNumber(),
                            raw.get(TransactionLoader.DATE_COLUMN), raw.get(TransactionLoader.AMOUNT_COLUMN));
                    continue;
                }
                String description = normalizeDescription(raw.get(TransactionLoader.DESCRIPTION_COLUMN));
                kept.add(new TransactionRecord(date, description, amount, null, extraFields(raw)));
            }
        } else {
            for (TransactionRecord record : transactions.records()) {
                kept.add(new TransactionRecord(
                        parseDate(record.date()),
                        normalizeDescription(record.description()),
                        parseAmount(record.amount()),
                        record.category(),
                        record.extraFields()));
            }
        }

        int dropped = transactions.size() - kept.size();
        CleaningReport report = new CleaningReport(transactions.size(), kept.size(), dropped, invalidDates, invalidAmounts);
        if (report.hasDroppedRows()) {
            log.warn("Dropped {} of {} row(s) during cleaning ({} invalid date(s), {} invalid amount(s)).",
                    dropped, report.inputRows(), invalidDates, invalidAmounts);
        } else {
            log.info("Cleaned {} row(s); nothing dropped.", kept.size());
        }

        TransactionSet cleaned = transactions.stage() == PipelineStage.CATEGORIZED
                ? TransactionSet.categorized(transactions.columns(), kept)
                : TransactionSet.cleaned(transactions.columns(), kept);
        return new CleaningResult(cleaned, report);
    }

	/**
	 * Interprets a date cell. Temporal values pass through; text is tried against the supported formats.
	 *
	 * @param value raw cell value
	 * @return parsed date or {@code null} when it cannot be interpreted
	 */
    LocalDate parseDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (!(value instanceof CharSequence sequence)) {
            return null;
        }
        String text = sequence.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return format.parse(text, LocalDate::from);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }

	/**
	 * Interprets an amount cell. Decimal values pass through unchanged; text loses currency symbols and
	 * thousands separators, and accountant-style parentheses mark a negative value.
	 *
	 * @param value raw cell value
	 * @return parsed amount or {@code null} when it cannot be interpreted
	 */
    BigDecimal parseAmount(Object value) {
        if (value instanceof BigDecimal decimal) {
            return inRange(decimal) ? decimal : null;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? ranged(BigDecimal.valueOf(number)) : null;
        }
        if (value instanceof BigInteger integer) {
            return ranged(new BigDecimal(integer));
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof CharSequence sequence) {
            return parseAmountText(sequence.toString());
        }
        return null;
    }

    private BigDecimal parseAmountText(String text) {
        String candidate = text.strip();
        boolean negative = false;
        if (candidate.length() > 2 && candidate.startsWith("(") && candidate.endsWith(")")) {
            negative = true;
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        candidate = AMOUNT_NOISE.matcher(candidate).replaceAll("");
        if (!PLAIN_DECIMAL.matcher(candidate).matches()) {
            return null;
        }
        BigDecimal amount = ranged(new BigDecimal(candidate));
        if (amount == null) {
            return null;
        }
        return negative ? amount.negate() : amount;
    }

    private String normalizeDescription(Object value) {
        if (value instanceof CharSequence sequence) {
            return sequence.toString().strip();
        }
        return "";
    }

    private Map<String, Object> extraFields(RawRecord raw) {
        Map<String, Object> extras = new LinkedHashMap<>();
        raw.values().forEach((column, value) -> {
            if (!TransactionLoader.isRequiredColumn(column)) {
                extras.put(column, value);
            }
        });
        return extras;
    }

    private static BigDecimal ranged(BigDecimal amount) {
        return inRange(amount) ? amount : null;
    }

    // bounds keep later sums and rounding cheap
    private static boolean inRange(BigDecimal amount) {
        return amount.scale() <= MAX_SCALE && amount.precision() - amount.scale() <= MAX_INTEGER_DIGITS;
    }

    private static DateTimeFormatter twoDigitYear(String monthDayPattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(monthDayPattern)
                .appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
