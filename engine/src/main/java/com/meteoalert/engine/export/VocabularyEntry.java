package com.meteoalert.engine.export;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * One entry of a reference vocabulary published by the delivery system (events or cities).
 */
public record VocabularyEntry(
        String id,
        @JsonAlias({"nome", "nomeEvento"}) String name
) {
}
