package com.hedgebot.engine.execution;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Customer references attached to placements: {@code {tradeIdPrefix}-{purpose}-{attempt}}, at most 32 characters.
 * A re-submitted placement carries the same reference, so the venue can recognise it.
 */
public final class CustomerRefs {

    public static final int MAX_LENGTH = 32;
    private static final int TRADE_PREFIX_LENGTH = 8;
    private static final Pattern ATTEMPT_SUFFIX = Pattern.compile("(.+-)(\\d{1,9})");

    private CustomerRefs() {
    }

    public static String of(String tradeId, String purpose, int attempt) {
        String compact = tradeId == null ? "" : tradeId.replace("-", "");
        String prefix = compact.length() > TRADE_PREFIX_LENGTH ? compact.substring(0, TRADE_PREFIX_LENGTH) : compact;
        String ref = prefix + "-" + purpose + "-" + attempt;
        return ref.length() <= MAX_LENGTH ? ref : ref.substring(0, MAX_LENGTH);
    }

    /**
     * Reference of the next attempt of the same instruction ({@code abc-entry-0} becomes {@code abc-entry-1}).
     */
    public static String nextAttempt(String ref) {
        if (ref == null) {
            return null;
        }
        Matcher matcher = ATTEMPT_SUFFIX.matcher(ref);
        String next = matcher.matches()
                ? matcher.group(1) + (Integer.parseInt(matcher.group(2)) + 1)
                : ref + "-1";
        return next.length() <= MAX_LENGTH ? next : next.substring(0, MAX_LENGTH);
    }
}
