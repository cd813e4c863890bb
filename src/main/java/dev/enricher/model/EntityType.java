package dev.enricher.model;

import java.util.Arrays;
import java.util.Optional;

public enum EntityType {
    MOVIE,
    SERIES,
    SEASON,
    EPISODE,
    ARTIST,
    ALBUM;

    public static Optional<EntityType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
