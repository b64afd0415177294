package com.eyelevel.documentanalyzer.extraction;

import com.eyelevel.documentanalyzer.model.ParsedFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls vendor, invoice number, date and total out of plain document text.
 * <p>
 * Every field has an ordered list of case-insensitive patterns. The first pattern that matches
 * anywhere in the text decides the field; later patterns are not consulted. Within a pattern the
 * leftmost match wins. The extractor is stateless and never throws: a field that cannot be found
 * is reported as {@code null}.
 */
@Slf4j
@Component
public class FieldExtractor {

    private static final String AMOUNT = "([$₹£]?\\s*[0-9,]+(?:\\.[0-9]{2})?)";

    static final List<Pattern> VENDOR_PATTERNS = compile(
            "From:[ ]*(.+)",
            "Vendor:[ ]*(.+)",
            "Bill To:[ ]*(.+)");

    static final List<Pattern> INVOICE_NUMBER_PATTERNS = compile(
            "Invoice\\s*No\\.?:?\\s*([\\w\\-/]+)",
            "Inv\\.?\\s*#\\s*([\\w\\-/]+)",
            "Invoice\\s*#\\s*([\\w\\-/]+)");

    static final List<Pattern> DATE_PATTERNS = compile(
            "(\\d{4}-\\d{2}-\\d{2})",
            "(\\d{2}/\\d{2}/\\d{4})",
            "(\\d{1,2} [A-Za-z]{3,9} \\d{4})");

    static final List<Pattern> TOTAL_PATTERNS = compile(
            "\\bTotal\\s*[:\\-]?\\s*" + AMOUNT,
            "\\bAmount\\s*[:\\-]?\\s*" + AMOUNT,
            "([$₹£]\\s*[0-9,]+(?:\\.[0-9]{2})?)");

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");

    /**
     * Extracts the candidate fields from the given text.
     *
     * @param text the decoded document text, may be {@code null} or empty.
     * @return the extracted fields; never {@code null}, individual fields may be {@code null}.
     */
    public ParsedFields extract(final String text) {
        if (text == null || text.isEmpty()) {
            return ParsedFields.empty();
        }

        final String normalized = normalize(text);
        final ParsedFields fields = ParsedFields.builder()
                                                .vendor(firstMatch(VENDOR_PATTERNS, normalized))
                                                .invoiceNo(firstMatch(INVOICE_NUMBER_PATTERNS, normalized))
                                                .invoiceDate(firstMatch(DATE_PATTERNS, normalized))
                                                .total(AmountNormalizer.normalize(firstMatch(TOTAL_PATTERNS, normalized)))
                                                .build();
        log.debug("Extracted fields from {} characters of text: {}", text.length(), fields);
        return fields;
    }

    /**
     * Unifies line endings to {@code \n} and collapses runs of horizontal whitespace to a single
     * space. Line structure is preserved.
     */
    static String normalize(final String text) {
        final String unixLines = LINE_BREAKS.matcher(text).replaceAll("\n");
        return HORIZONTAL_WHITESPACE.matcher(unixLines).replaceAll(" ");
    }

    /**
     * Walks the patterns in priority order and returns the value of the first usable match.
     * A match whose value is blank after trimming is skipped.
     */
    static String firstMatch(final List<Pattern> patterns, final String text) {
        for (final Pattern pattern : patterns) {
            final Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                final String value = valueOf(matcher);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static String valueOf(final Matcher matcher) {
        if (matcher.groupCount() == 0) {
            return nonBlank(matcher.group());
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            final String value = nonBlank(matcher.group(group));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String nonBlank(final String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static List<Pattern> compile(final String... regexes) {
        return Arrays.stream(regexes)
                     .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                     .toList();
    }
}
