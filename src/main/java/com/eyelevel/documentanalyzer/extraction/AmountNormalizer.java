package com.eyelevel.documentanalyzer.extraction;

import java.util.regex.Pattern;

/**
 * Reduces a captured monetary amount such as {@code "$2,000.00"} or {@code "₹ 1,234"} to a plain
 * decimal string ({@code "2000.00"}, {@code "1234"}). Currency symbols are handled as literal
 * characters; no locale-aware number parsing is involved.
 */
public final class AmountNormalizer {

    private static final char NO_BREAK_SPACE = '\u00A0';
    private static final Pattern DISALLOWED_CHARACTERS = Pattern.compile("[^0-9.,$₹£]");
    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$₹£]");

    private AmountNormalizer() {
    }

    /**
     * @param rawAmount the amount as captured from the document, may be {@code null}.
     * @return the digits and decimal point of the amount, or {@code null} if nothing numeric remains.
     */
    public static String normalize(final String rawAmount) {
        if (rawAmount == null || rawAmount.isEmpty()) {
            return null;
        }
        String amount = rawAmount.replace(NO_BREAK_SPACE, ' ').trim();
        amount = DISALLOWED_CHARACTERS.matcher(amount).replaceAll("");
        amount = amount.replace(",", "");
        amount = CURRENCY_SYMBOLS.matcher(amount).replaceAll("");
        return amount.isEmpty() ? null : amount;
    }
}
