package io.verdict.core.util;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/// Extracts numeric values from free-text responses.
///
/// Only plain decimal literals are accepted (optional sign, digits, optional
/// fraction, optional exponent), plus comma thousands groupings such as `1,500`
/// or `12,000.50`. `NaN`, `Infinity`, hexadecimal and type-suffixed forms that
/// {@link Double#parseDouble(String)} would otherwise accept are rejected.
public final class NumberExtractor {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Pattern GROUPED =
            Pattern.compile("[+-]?\\d{1,3}(?:,\\d{3})+(?:\\.\\d*)?");

    // Commas and periods are left out so "1,500" and "2.5" survive tokenization.
    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s!?;:]+");

    private static final Pattern COMMA = Pattern.compile(",+");

    private static final String LEADING_PUNCTUATION = "$([{\"'`";
    private static final String TRAILING_PUNCTUATION = ".,%)]}\"'`";

    private NumberExtractor() {}

    /// Parses a whole string as a decimal literal, ignoring surrounding whitespace.
    ///
    /// @param text text to parse, may be null
    /// @return the value, or empty if the text is not a decimal literal
    public static OptionalDouble parse(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String trimmed = text.trim();
        if (GROUPED.matcher(trimmed).matches()) {
            trimmed = trimmed.replace(",", "");
        } else if (!DECIMAL.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /// Finds the first number in a response.
    ///
    /// The whole trimmed response is tried first. Otherwise the response is split
    /// on whitespace and sentence punctuation, and surrounding punctuation such as
    /// currency and percent signs is stripped from each token. Tokens are tried in
    /// order. A token that is not a number as a whole is split further on commas.
    ///
    /// @param response free-text response, may be null
    /// @return the first number found, or empty if there is none
    public static OptionalDouble extract(String response) {
        OptionalDouble whole = parse(response);
        if (whole.isPresent() || response == null) {
            return whole;
        }
        for (String token : TOKEN_SEPARATORS.split(response)) {
            OptionalDouble value = parseToken(token);
            if (value.isPresent()) {
                return value;
            }
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble parseToken(String token) {
        OptionalDouble value = parse(stripEdgePunctuation(token));
        if (value.isPresent() || token.indexOf(',') < 0) {
            return value;
        }
        for (String part : COMMA.split(token)) {
            value = parse(stripEdgePunctuation(part));
            if (value.isPresent()) {
                return value;
            }
        }
        return OptionalDouble.empty();
    }

    private static String stripEdgePunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && LEADING_PUNCTUATION.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRAILING_PUNCTUATION.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
