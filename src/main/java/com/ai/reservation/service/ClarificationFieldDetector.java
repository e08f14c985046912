package com.ai.reservation.service;

import com.ai.reservation.conversation.ReservationField;
import com.ai.reservation.dto.ConfirmationResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which confirmed fields staff wants to go over again after an unclear confirmation.
 * An explicit field list from the model wins; otherwise the error text is scanned for keywords.
 */
@Service
public class ClarificationFieldDetector {

    /** Plain case-insensitive substring match, so "phone number" and "telephone" both hit. */
    private static final Map<String, ReservationField> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("date", ReservationField.DATE);
        KEYWORDS.put("time", ReservationField.TIME);
        KEYWORDS.put("phone", ReservationField.CONTACT_PHONE);
        KEYWORDS.put("name", ReservationField.CONTACT_NAME);
    }

    public Set<ReservationField> fieldsToReconfirm(ConfirmationResult result) {
        if (result.getFieldsNeedingClarification() != null) {
            Set<ReservationField> explicit = EnumSet.noneOf(ReservationField.class);
            result.getFieldsNeedingClarification().stream()
                    .filter(Objects::nonNull)
                    .forEach(explicit::add);
            if (!explicit.isEmpty()) {
                return explicit;
            }
        }
        return mentionedIn(result.getErrorMessage());
    }

    public Set<ReservationField> mentionedIn(String text) {
        if (StringUtils.isBlank(text)) return Collections.emptySet();
        Set<ReservationField> fields = EnumSet.noneOf(ReservationField.class);
        KEYWORDS.forEach((keyword, field) -> {
            if (StringUtils.containsIgnoreCase(text, keyword)) {
                fields.add(field);
            }
        });
        return fields;
    }
}
