package com.stayharvest.crawl.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces the identifier encodings seen in provider payloads to one canonical digit string.
 * <p>
 * Strategies run in a fixed order and the first one that yields a value wins. None of them throw,
 * so {@link #normalize(Object)} is total.
 */
public final class IdentifierNormalizer {
    static final List<String> TOKEN_PREFIXES = List.of(
        "StayListing:",
        "DemandStayListing:",
        "StayListingProduct:",
        "listing:",
        "rooms/"
    );
    static final List<String> ENCODED_PREFIXES = List.of(
        "StayListing:",
        "DemandStayListing:",
        "StayListingProduct:"
    );
    static final List<String> FALLBACK_KEYS = List.of("listingId", "id", "roomId");

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final int MIN_ENCODED_LENGTH = 10;

    private static final List<Function<String, Optional<String>>> TEXT_STRATEGIES = List.of(
        IdentifierNormalizer::fromDigits,
        IdentifierNormalizer::fromExponent,
        IdentifierNormalizer::fromPrefixedToken,
        IdentifierNormalizer::fromPath,
        IdentifierNormalizer::fromBase64
    );

    private IdentifierNormalizer() {
    }

    public static Optional<String> normalize(Object raw) {
        return normalize(raw, null);
    }

    public static Optional<String> normalize(Object raw, Map<String, ?> fallbackContainer) {
        if (raw == null) {
            if (fallbackContainer == null) {
                return Optional.empty();
            }
            for (String key : FALLBACK_KEYS) {
                Object candidate = fallbackContainer.get(key);
                if (candidate == null) {
                    continue;
                }
                Optional<String> resolved = normalize(candidate, null);
                if (resolved.isPresent()) {
                    return resolved;
                }
            }
            return Optional.empty();
        }
        if (raw instanceof JsonNode node) {
            return normalizeNode(node, null);
        }
        if (raw instanceof BigInteger value) {
            return fromInteger(value);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return fromInteger(BigInteger.valueOf(((Number) raw).longValue()));
        }
        if (raw instanceof CharSequence text) {
            return fromText(text.toString());
        }
        return Optional.empty();
    }

    /**
     * JSON flavour of {@link #normalize(Object, Map)}: the fallback container is an object node and
     * its {@code listingId}, {@code id} and {@code roomId} fields are tried when {@code raw} is missing.
     */
    public static Optional<String> normalizeNode(JsonNode raw, JsonNode fallbackContainer) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            if (fallbackContainer == null || !fallbackContainer.isObject()) {
                return Optional.empty();
            }
            for (String key : FALLBACK_KEYS) {
                JsonNode candidate = fallbackContainer.get(key);
                if (candidate == null || candidate.isNull()) {
                    continue;
                }
                Optional<String> resolved = normalizeNode(candidate, null);
                if (resolved.isPresent()) {
                    return resolved;
                }
            }
            return Optional.empty();
        }
        if (raw.isIntegralNumber()) {
            return fromInteger(raw.bigIntegerValue());
        }
        if (raw.isNumber()) {
            if (raw.canConvertToExactIntegral()) {
                return fromInteger(raw.decimalValue().toBigInteger());
            }
            return Optional.empty();
        }
        if (raw.isTextual()) {
            return fromText(raw.textValue());
        }
        return Optional.empty();
    }

    static Optional<String> fromText(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, Optional<String>> strategy : TEXT_STRATEGIES) {
            Optional<String> resolved = strategy.apply(value);
            if (resolved.isPresent()) {
                return resolved;
            }
        }
        return Optional.empty();
    }

    static Optional<String> fromInteger(BigInteger value) {
        if (value == null || value.signum() < 0) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    static Optional<String> fromDigits(String value) {
        return isAllDigits(value) ? Optional.of(value) : Optional.empty();
    }

    static Optional<String> fromExponent(String value) {
        if (!value.toLowerCase(Locale.ROOT).contains("e+")) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                return Optional.empty();
            }
            return fromInteger(new BigDecimal(parsed).toBigInteger());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<String> fromPrefixedToken(String value) {
        for (String prefix : TOKEN_PREFIXES) {
            int index = value.lastIndexOf(prefix);
            if (index < 0) {
                continue;
            }
            Matcher matcher = DIGIT_RUN.matcher(value.substring(index + prefix.length()));
            if (matcher.find()) {
                return Optional.of(matcher.group());
            }
        }
        return Optional.empty();
    }

    static Optional<String> fromPath(String value) {
        if (!value.contains("/") || !value.contains("rooms")) {
            return Optional.empty();
        }
        String[] segments = value.split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (isAllDigits(segments[i])) {
                return Optional.of(segments[i]);
            }
        }
        return Optional.empty();
    }

    static Optional<String> fromBase64(String value) {
        if (value.length() <= MIN_ENCODED_LENGTH || isAllDigits(value)) {
            return Optional.empty();
        }
        String decoded = decodeBase64(value);
        if (decoded == null) {
            return Optional.empty();
        }
        for (String prefix : ENCODED_PREFIXES) {
            int index = decoded.lastIndexOf(prefix);
            if (index < 0) {
                continue;
            }
            String tail = decoded.substring(index + prefix.length());
            int comma = tail.indexOf(',');
            String candidate = (comma >= 0 ? tail.substring(0, comma) : tail).trim();
            if (isAllDigits(candidate)) {
                return Optional.of(candidate);
            }
        }
        String trimmed = decoded.trim();
        return isAllDigits(trimmed) ? Optional.of(trimmed) : Optional.empty();
    }

    private static String decodeBase64(String value) {
        String padded = value;
        int missing = padded.length() % 4;
        if (missing != 0) {
            padded = padded + "=".repeat(4 - missing);
        }
        try {
            return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException standardAlphabetFailure) {
            try {
                return new String(Base64.getUrlDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }

    static boolean isAllDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
