package com.ai.reservation.memory;

import com.ai.reservation.conversation.ReservationField;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Which booking fields staff has explicitly confirmed.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConfirmedFields {

    boolean date;
    boolean time;
    boolean partySize;
    boolean occasion;
    boolean specialRequests;
    boolean contactName;
    boolean contactPhone;

    public static ConfirmedFields none() {
        return ConfirmedFields.builder().build();
    }

    public static ConfirmedFields all() {
        return new ConfirmedFields(true, true, true, true, true, true, true);
    }

    /**
     * The only gate out of the contact phase: every tracked field is confirmed.
     */
    public boolean allRequiredConfirmed() {
        return date && time && partySize && occasion && specialRequests && contactName && contactPhone;
    }

    public boolean isConfirmed(ReservationField field) {
        switch (field) {
            case DATE: return date;
            case TIME: return time;
            case PARTY_SIZE: return partySize;
            case OCCASION: return occasion;
            case SPECIAL_REQUESTS: return specialRequests;
            case CONTACT_NAME: return contactName;
            case CONTACT_PHONE: return contactPhone;
            default: return false;
        }
    }

    public ConfirmedFields with(ReservationField field, boolean confirmed) {
        ConfirmedFieldsBuilder b = toBuilder();
        switch (field) {
            case DATE: b.date(confirmed); break;
            case TIME: b.time(confirmed); break;
            case PARTY_SIZE: b.partySize(confirmed); break;
            case OCCASION: b.occasion(confirmed); break;
            case SPECIAL_REQUESTS: b.specialRequests(confirmed); break;
            case CONTACT_NAME: b.contactName(confirmed); break;
            case CONTACT_PHONE: b.contactPhone(confirmed); break;
            default: break;
        }
        return b.build();
    }

    /**
     * First field still unconfirmed, following {@link ReservationField#ASK_ORDER}.
     */
    public Optional<ReservationField> firstUnconfirmed() {
        return ReservationField.ASK_ORDER.stream()
                .filter(field -> !isConfirmed(field))
                .findFirst();
    }
}
