package org.notifkit.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One tracked notification as persisted. The group key is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"identifier", "platformId", "groupKey"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SnapshotEntry(String identifier, int platformId, String groupKey) {
}
