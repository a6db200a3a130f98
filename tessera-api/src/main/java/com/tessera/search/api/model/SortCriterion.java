package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;

import java.io.Serializable;
import java.util.Locale;

/**
 * A request-level sort such as {@code price:asc}.
 */
public record SortCriterion(
    @JsonProperty("field") String field,
    @JsonProperty("ascending") boolean ascending
) implements Serializable {

    /**
     * Parses {@code <field>:asc} or {@code <field>:desc}.
     *
     * @throws UserErrorException with {@link ErrorCode#INVALID_SORT_CRITERION} when malformed
     */
    public static SortCriterion parse(String text) {
        if (text == null) {
            throw new UserErrorException(ErrorCode.INVALID_SORT_CRITERION, "Sort criterion cannot be null");
        }
        int colon = text.lastIndexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new UserErrorException(ErrorCode.INVALID_SORT_CRITERION,
                String.format("Invalid sort criterion `%s`, expected `field:asc` or `field:desc`", text));
        }
        String field = text.substring(0, colon).trim();
        String direction = text.substring(colon + 1).trim().toLowerCase(Locale.ROOT);
        return switch (direction) {
            case "asc" -> new SortCriterion(field, true);
            case "desc" -> new SortCriterion(field, false);
            default -> throw new UserErrorException(ErrorCode.INVALID_SORT_CRITERION,
                String.format("Invalid sort direction `%s` in `%s`", direction, text));
        };
    }

    @Override
    public String toString() {
        return field + (ascending ? ":asc" : ":desc");
    }
}
