package com.casegovernor.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Message on the case data broadcast channel.
 *
 * load / refresh messages published by the hub carry a serialized PageData.
 * A refresh message without a payload is a refresh request sent by a consumer.
 * error messages carry {@code errorMessage} and never a payload.
 * {@code sequenceNumber} is assigned by the channel on publish.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelMessage(
    String caseId,
    ChannelEventType eventType,
    String pageData,
    String section,
    String errorMessage,
    Instant timestamp,
    Long sequenceNumber
) {

    public static ChannelMessage load(String caseId, String pageData, Instant timestamp) {
        return new ChannelMessage(caseId, ChannelEventType.LOAD, pageData, null, null, timestamp, null);
    }

    public static ChannelMessage refresh(String caseId, String pageData, String section, Instant timestamp) {
        return new ChannelMessage(caseId, ChannelEventType.REFRESH, pageData, section, null, timestamp, null);
    }

    public static ChannelMessage refreshRequest(String caseId, String section, Instant timestamp) {
        return new ChannelMessage(caseId, ChannelEventType.REFRESH, null, section, null, timestamp, null);
    }

    public static ChannelMessage error(String caseId, String errorMessage, Instant timestamp) {
        return new ChannelMessage(caseId, ChannelEventType.ERROR, null, null, errorMessage, timestamp, null);
    }

    public ChannelMessage withSequenceNumber(long sequence) {
        return new ChannelMessage(caseId, eventType, pageData, section, errorMessage, timestamp, sequence);
    }

    public boolean hasPageData() {
        return pageData != null && !pageData.isBlank();
    }

    public boolean refreshRequested() {
        return eventType == ChannelEventType.REFRESH && !hasPageData();
    }
}
