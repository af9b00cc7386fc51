package com.ora.normalization.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for ShipStation SKU values.
 *
 * <p>Supported formats:
 * <ul>
 *   <li>{@code "17612 - 250300"}, {@code "17612-250300"}: SKU 17612, lot 250300</li>
 *   <li>{@code "18795"}: SKU 18795, no lot</li>
 * </ul>
 */
@Component
@Slf4j
public class SkuLotParser implements RecordParser {

    // Any amount of whitespace around the dash
    private static final Pattern SKU_LOT_PATTERN = Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)$");

    @Override
    public ParseResult parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            return ParseResult.invalid("", "Empty SKU provided");
        }

        String trimmed = raw.trim();

        Matcher matcher = SKU_LOT_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            log.trace("Parsed SKU-lot format: '{}' -> base={}, lot={}", trimmed, matcher.group(1), matcher.group(2));
            return ParseResult.valid(trimmed, matcher.group(1), matcher.group(2));
        }

        if (StringUtils.isNumeric(trimmed)) {
            return ParseResult.valid(trimmed, trimmed, null);
        }

        return ParseResult.invalid(trimmed, "Invalid SKU format: " + trimmed);
    }
}
