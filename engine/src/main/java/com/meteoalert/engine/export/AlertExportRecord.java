package com.meteoalert.engine.export;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One alert as submitted to the delivery system. The JSON property names are that system's
 * contract and must not change on one side only.
 */
@JsonPropertyOrder({
        "idEvento", "idCidade", "valor", "valorLimite", "diferenca",
        "dataGeracao", "dataReferencia", "unidadeMedida", "horario", "segundos"
})
public record AlertExportRecord(
        @JsonProperty("idEvento") String eventId,
        @JsonProperty("idCidade") String cityId,
        @JsonProperty("valor") double value,
        @JsonProperty("valorLimite") double thresholdValue,
        @JsonProperty("diferenca") double difference,
        @JsonProperty("dataGeracao") LocalDate generationDate,
        @JsonProperty("dataReferencia") LocalDate referenceDate,
        @JsonProperty("unidadeMedida") String unit,
        @JsonProperty("horario") @JsonFormat(pattern = "HH:mm") LocalTime time,
        @JsonProperty("segundos") int secondsOffset
) {
}
