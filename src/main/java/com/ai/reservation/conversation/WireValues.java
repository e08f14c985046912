package com.ai.reservation.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.function.Function;

/**
 * Lenient enum lookup for values coming back from the model: accepts the wire value
 * ("slot_accepted") or the constant name ("SLOT_ACCEPTED"), ignoring case and spaces.
 */
final class WireValues {

    private WireValues() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String raw, Function<E, String> wireValue, E fallback) {
        if (StringUtils.isBlank(raw)) return fallback;
        String normalized = raw.trim().replace(' ', '_').replace('-', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(normalized)
                    || wireValue.apply(constant).equalsIgnoreCase(normalized)) {
                return constant;
            }
        }
        return fallback;
    }
}
