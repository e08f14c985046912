package com.ai.reservation.memory;

import com.ai.reservation.conversation.ReservationField;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Structured booking information. Used for the goal the guest starts with and for what staff
 * actually agreed to. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReservationDetails {

    public static final int MIN_PARTY_SIZE = 1;
    public static final int MAX_PARTY_SIZE = 16;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("time")
    LocalTime time;

    @JsonProperty("party_size")
    Integer partySize;

    @JsonProperty("occasion")
    String occasion;

    @JsonProperty("special_requests")
    String specialRequests;

    @JsonProperty("contact_name")
    String contactName;

    @JsonProperty("contact_phone")
    String contactPhone;

    public static ReservationDetails empty() {
        return ReservationDetails.builder().build();
    }

    /**
     * True when the field carries a value. Blank text counts as absent.
     */
    public boolean has(ReservationField field) {
        switch (field) {
            case DATE: return date != null;
            case TIME: return time != null;
            case PARTY_SIZE: return partySize != null;
            case OCCASION: return StringUtils.isNotBlank(occasion);
            case SPECIAL_REQUESTS: return StringUtils.isNotBlank(specialRequests);
            case CONTACT_NAME: return StringUtils.isNotBlank(contactName);
            case CONTACT_PHONE: return StringUtils.isNotBlank(contactPhone);
            default: return false;
        }
    }

    /**
     * Copies the given field from {@code source} into a new instance; other fields are kept.
     */
    public ReservationDetails withFieldFrom(ReservationField field, ReservationDetails source) {
        ReservationDetailsBuilder b = toBuilder();
        switch (field) {
            case DATE: b.date(source.getDate()); break;
            case TIME: b.time(source.getTime()); break;
            case PARTY_SIZE: b.partySize(source.getPartySize()); break;
            case OCCASION: b.occasion(source.getOccasion()); break;
            case SPECIAL_REQUESTS: b.specialRequests(source.getSpecialRequests()); break;
            case CONTACT_NAME: b.contactName(source.getContactName()); break;
            case CONTACT_PHONE: b.contactPhone(source.getContactPhone()); break;
            default: break;
        }
        return b.build();
    }

    /**
     * Copy with the given field cleared.
     */
    public ReservationDetails withoutField(ReservationField field) {
        return withFieldFrom(field, empty());
    }
}
