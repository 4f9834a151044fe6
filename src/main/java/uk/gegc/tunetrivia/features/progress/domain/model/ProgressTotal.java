package uk.gegc.tunetrivia.features.progress.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Total item count of a job, or the {@code "unknown"} sentinel while the job is still
 * working it out. Any non-numeric wire value reads as unknown.
 */
public record ProgressTotal(Integer count) {

    public static final String UNKNOWN_SENTINEL = "unknown";

    private static final ProgressTotal UNKNOWN = new ProgressTotal(null);

    public ProgressTotal {
        if (count != null && count < 0) {
            throw new IllegalArgumentException("Total count must not be negative: " + count);
        }
    }

    public static ProgressTotal of(int count) {
        return new ProgressTotal(count);
    }

    public static ProgressTotal unknown() {
        return UNKNOWN;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ProgressTotal fromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return UNKNOWN;
        }
        if (node.isIntegralNumber() && node.asLong() >= 0) {
            return new ProgressTotal(node.asInt());
        }
        if (node.isTextual()) {
            try {
                int parsed = Integer.parseInt(node.asText().trim());
                return parsed >= 0 ? new ProgressTotal(parsed) : UNKNOWN;
            } catch (NumberFormatException e) {
                return UNKNOWN;
            }
        }
        return UNKNOWN;
    }

    public boolean isKnown() {
        return count != null;
    }

    @JsonValue
    public Object toJson() {
        return count != null ? count : UNKNOWN_SENTINEL;
    }
}
