package com.example.offshore.allocation.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits charge-code text such as {@code "7777, 8888"}, {@code "7777/8888"} or
 * {@code "9358 45; 10137 12; 10101"} into LC tokens with percentage shares summing to 100.
 */
@Slf4j
@Component
public class LcParser {

    private static final Pattern DELIMITERS = Pattern.compile("[,/;|]");
    private static final Pattern EXPLICIT_SHARE = Pattern.compile("^(.+?)\\s+(\\d+(?:\\.\\d+)?)%?$");
    private static final double FULL = 100.0;
    private static final double TOLERANCE = 0.01;

    public LcSplit parse(String chargeCode) {
        if (chargeCode == null || chargeCode.isBlank()) {
            return LcSplit.EMPTY;
        }

        Map<String, Double> tokens = tokenize(chargeCode);
        if (tokens.isEmpty()) {
            return LcSplit.EMPTY;
        }
        if (tokens.values().stream().allMatch(share -> share == null)) {
            return equalSplit(tokens.keySet());
        }
        return explicitSplit(chargeCode, tokens);
    }

    private Map<String, Double> tokenize(String chargeCode) {
        Map<String, Double> tokens = new LinkedHashMap<>();
        for (String part : DELIMITERS.split(chargeCode)) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String lcNumber = trimmed;
            Double share = null;
            Matcher matcher = EXPLICIT_SHARE.matcher(trimmed);
            if (matcher.matches()) {
                double parsed = Double.parseDouble(matcher.group(2));
                if (parsed <= FULL) {
                    lcNumber = matcher.group(1).trim();
                    share = parsed;
                }
            }
            tokens.putIfAbsent(lcNumber, share);
        }
        return tokens;
    }

    private static LcSplit equalSplit(Iterable<String> lcNumbers) {
        List<String> ordered = new ArrayList<>();
        lcNumbers.forEach(ordered::add);
        double share = FULL / ordered.size();
        return new LcSplit(ordered.stream().map(lc -> new LcAllocation(lc, share)).toList());
    }

    private LcSplit explicitSplit(String chargeCode, Map<String, Double> tokens) {
        double allocated = tokens.values().stream().filter(share -> share != null).mapToDouble(Double::doubleValue).sum();
        if (allocated <= 0) {
            return equalSplit(tokens.keySet());
        }

        long withoutShare = tokens.values().stream().filter(share -> share == null).count();
        double remainder = Math.max(0, FULL - allocated);
        double remainderShare = withoutShare > 0 ? remainder / withoutShare : 0;
        if (withoutShare > 0 && remainder == 0) {
            log.warn("No remainder left for LCs without a share in '{}', assigning 0%", chargeCode);
        }

        Map<String, Double> shares = new LinkedHashMap<>();
        tokens.forEach((lc, share) -> shares.put(lc, share != null ? share : remainderShare));

        double total = shares.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(total - FULL) > TOLERANCE) {
            log.debug("Normalizing LC shares for '{}' from {}% to 100%", chargeCode, total);
            double factor = FULL / total;
            shares.replaceAll((lc, share) -> share * factor);
        }
        return new LcSplit(shares.entrySet().stream()
                .map(entry -> new LcAllocation(entry.getKey(), entry.getValue()))
                .toList());
    }
}
