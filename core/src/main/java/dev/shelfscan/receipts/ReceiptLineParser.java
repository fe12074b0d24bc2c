package dev.shelfscan.receipts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw OCR lines into product candidates and receipt metadata.
 *
 * <p>Lines are scanned once. Merchant, date, invoice number and total are picked up along the way;
 * remaining lines are tried against the tabular layout first and a token based heuristic second.
 * Parsing never fails: unrecognised input simply yields no candidates.</p>
 */
public class ReceiptLineParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptLineParser.class);

    static final int MERCHANT_SCAN_LINES = 3;
    static final double TABULAR_CONFIDENCE = 0.9;
    static final double CLEANED_NAME_CONFIDENCE = 0.85;
    static final double RAW_NAME_CONFIDENCE = 0.8;

    private static final String PRICE = "\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+[.,]\\d{1,2}";

    private static final Pattern TABULAR_LINE = Pattern.compile(
        "^(?<name>\\p{L}.*?)\\s+(?<qty>\\d+(?:\\.\\d+)?)\\s+(?<unit>" + PRICE + ")"
            + "(?:\\s+(?:" + PRICE + "))*\\s+(?<total>" + PRICE + ")$");
    private static final Pattern DATE = Pattern.compile(
        "\\b(?<date>\\d{4}-\\d{2}-\\d{2}|\\d{1,2}[/\\-.]\\d{1,2}[/\\-.]\\d{2,4})\\b");
    private static final Pattern INVOICE = Pattern.compile(
        "\\b(?:invoice|inv|bill|receipt)\\s*(?:no|number|#)?\\.?\\s*[:#]\\s*(?<number>[A-Za-z0-9][A-Za-z0-9\\-/]*)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBTOTAL = Pattern.compile("\\bsub\\s*-?\\s*total\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_KEYWORD = Pattern.compile(
        "\\b(?:grand\\s*total|final\\s*total|net\\s*amount|total|sum|amount)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_WORD = Pattern.compile(
        "\\b(?:item|items|description|product|particulars|qty|quantity|price|rate|mrp|amount|total|net)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIP_LINE = Pattern.compile(
        "^(?:tax|vat|gst|cgst|sgst|discount|change|tender|cashier|clerk|thank\\s*you|payment|balance|address"
            + "|email|website|www)\\b",
        Pattern.CASE_INSENSITIVE);
    // Skipped only when used as a label ("Card: 1234"), since "Date Syrup" or "Phone Charger" are products
    private static final Pattern LABEL_LINE = Pattern.compile(
        "^(?:date|time|phone|tel|card|cash|method)\\b\\s*(?:[:#.\\d]|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MERCHANT_SKIP = Pattern.compile(
        "^(?:receipt|invoice|bill|store|shop|market|welcome)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?:rs\\.?|inr|[₹$€£])", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUPED_AMOUNT = Pattern.compile("^\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?$");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("^\\d+,\\d{1,2}$");
    private static final Pattern PLAIN_AMOUNT = Pattern.compile("^\\d+(?:\\.\\d+)?$");
    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern QUANTITY_MARKER = Pattern.compile("^(?:x(?<a>\\d+)|(?<b>\\d+)x)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_TOKEN_SEPARATOR = Pattern.compile("[\\s:]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final ProductNameCleaner nameCleaner;
    private final ConfidenceScorer scorer;

    public ReceiptLineParser() {
        this(new ProductNameCleaner(), new ConfidenceScorer());
    }

    public ReceiptLineParser(ProductNameCleaner nameCleaner, ConfidenceScorer scorer) {
        this.nameCleaner = Objects.requireNonNull(nameCleaner, "nameCleaner");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public ReceiptLineParseResult parse(List<String> rawLines) {
        Objects.requireNonNull(rawLines, "rawLines");

        String merchantName = null;
        String invoiceNumber = null;
        String date = null;
        BigDecimal totalAmount = null;
        boolean totalLineSeen = false;
        int tabularMatches = 0;
        int heuristicMatches = 0;
        int contentIndex = 0;

        Map<String, ExtractedCandidate> candidates = new LinkedHashMap<>();

        for (String rawLine : rawLines) {
            String line = normalize(rawLine);
            if (line.isEmpty()) {
                continue;
            }
            int index = contentIndex++;

            if (merchantName == null && index < MERCHANT_SCAN_LINES && isMerchantLine(line)) {
                merchantName = line;
                continue;
            }

            Matcher dateMatcher = DATE.matcher(line);
            if (dateMatcher.find()) {
                if (date == null) {
                    date = dateMatcher.group("date");
                }
                continue;
            }

            Matcher invoiceMatcher = INVOICE.matcher(line);
            if (invoiceMatcher.find()) {
                if (invoiceNumber == null) {
                    invoiceNumber = invoiceMatcher.group("number");
                }
                continue;
            }

            if (isHeaderLine(line) || SUBTOTAL.matcher(line).find()) {
                continue;
            }

            if (TOTAL_KEYWORD.matcher(line).find()) {
                if (!totalLineSeen) {
                    totalLineSeen = true;
                    totalAmount = trailingAmount(line);
                    if (totalAmount == null) {
                        LOGGER.debug("Total line without a numeric amount: '{}'", line);
                    }
                }
                continue;
            }

            if (isBoilerplate(line)) {
                continue;
            }

            CandidateDraft draft = parseTabular(line);
            if (draft != null) {
                tabularMatches++;
            } else {
                draft = parseHeuristic(line);
                if (draft == null) {
                    continue;
                }
                heuristicMatches++;
            }

            String key = draft.name().trim().toLowerCase(Locale.ROOT);
            if (candidates.containsKey(key)) {
                LOGGER.debug("Dropping repeated line item '{}'", draft.name());
                continue;
            }
            candidates.put(key, scorer.score(draft));
        }

        ReceiptFormatType formatType = tabularMatches > 0
            ? ReceiptFormatType.TABULAR
            : heuristicMatches > 0 ? ReceiptFormatType.SIMPLE_LIST : ReceiptFormatType.UNKNOWN;

        LOGGER.debug("Parsed {} lines into {} candidates (format {})", rawLines.size(), candidates.size(), formatType);
        return new ReceiptLineParseResult(
            new ArrayList<>(candidates.values()),
            new ReceiptMetadata(merchantName, invoiceNumber, date, totalAmount, formatType));
    }

    private CandidateDraft parseTabular(String line) {
        Matcher matcher = TABULAR_LINE.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String rawName = matcher.group("name").trim();
        String cleaned = nameCleaner.clean(rawName);
        BigDecimal quantity = parseAmount(matcher.group("qty"));
        BigDecimal lineTotal = parseAmount(matcher.group("total"));
        if (lineTotal == null || quantity == null) {
            return null;
        }
        return CandidateDraft.builder()
            .name(cleaned.isEmpty() ? rawName : cleaned)
            .price(lineTotal)
            .quantity(quantity)
            .hints(new ConfidenceHints(TABULAR_CONFIDENCE, TABULAR_CONFIDENCE, TABULAR_CONFIDENCE, null,
                TABULAR_CONFIDENCE))
            .originalText(line)
            .build();
    }

    private CandidateDraft parseHeuristic(String line) {
        String[] tokens = WHITESPACE.split(line);
        int firstNumeric = -1;
        List<BigDecimal> numbers = new ArrayList<>();
        List<String> numericTokens = new ArrayList<>();
        BigDecimal markedQuantity = null;

        for (int i = 0; i < tokens.length; i++) {
            BigDecimal value = parseAmount(tokens[i]);
            if (value != null) {
                if (firstNumeric < 0) {
                    firstNumeric = i;
                }
                numbers.add(value);
                numericTokens.add(tokens[i]);
                continue;
            }
            Matcher marker = QUANTITY_MARKER.matcher(tokens[i]);
            if (marker.matches() && markedQuantity == null) {
                String digits = marker.group("a") != null ? marker.group("a") : marker.group("b");
                markedQuantity = new BigDecimal(digits);
            }
        }

        if (numbers.isEmpty() || firstNumeric == 0) {
            return null;
        }

        String rawName = String.join(" ", Arrays.copyOfRange(tokens, 0, firstNumeric));
        if (!LETTER.matcher(rawName).find()) {
            return null;
        }
        String cleaned = nameCleaner.clean(rawName);
        if (cleaned.isEmpty() || !LETTER.matcher(cleaned).find()) {
            return null;
        }
        double confidence = cleaned.equals(rawName) ? RAW_NAME_CONFIDENCE : CLEANED_NAME_CONFIDENCE;

        BigDecimal price = numbers.get(numbers.size() - 1);
        BigDecimal quantity = markedQuantity;
        if (quantity == null) {
            for (int i = 0; i < numericTokens.size() - 1; i++) {
                if (INTEGER.matcher(numericTokens.get(i)).matches()) {
                    quantity = numbers.get(i);
                    break;
                }
            }
        }

        return CandidateDraft.builder()
            .name(cleaned)
            .price(price)
            .quantity(quantity)
            .hints(new ConfidenceHints(confidence, confidence, quantity == null ? null : confidence, null, confidence))
            .originalText(line)
            .build();
    }

    private static boolean isMerchantLine(String line) {
        return line.length() > 3
            && !DIGIT.matcher(line).find()
            && LETTER.matcher(line).find()
            && !MERCHANT_SKIP.matcher(line).find()
            && !isBoilerplate(line)
            && !TOTAL_KEYWORD.matcher(line).find()
            && !isHeaderLine(line);
    }

    private static boolean isBoilerplate(String line) {
        return SKIP_LINE.matcher(line).find() || LABEL_LINE.matcher(line).find();
    }

    private static boolean isHeaderLine(String line) {
        if (DIGIT.matcher(line).find()) {
            return false;
        }
        Matcher matcher = HEADER_WORD.matcher(line);
        int hits = 0;
        while (matcher.find()) {
            hits++;
        }
        return hits >= 2;
    }

    private static BigDecimal trailingAmount(String line) {
        String[] tokens = TOTAL_TOKEN_SEPARATOR.split(line);
        if (tokens.length == 0) {
            return null;
        }
        return parseAmount(tokens[tokens.length - 1]);
    }

    static BigDecimal parseAmount(String token) {
        if (token == null) {
            return null;
        }
        String value = CURRENCY_PREFIX.matcher(token.trim()).replaceFirst("");
        if (GROUPED_AMOUNT.matcher(value).matches()) {
            value = value.replace(",", "");
        } else if (COMMA_DECIMAL.matcher(value).matches()) {
            value = value.replace(',', '.');
        }
        if (!PLAIN_AMOUNT.matcher(value).matches()) {
            return null;
        }
        return new BigDecimal(value);
    }

    private static String normalize(String line) {
        if (line == null) {
            return "";
        }
        return WHITESPACE.matcher(line.trim()).replaceAll(" ");
    }
}
