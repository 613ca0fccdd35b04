package com.ama.nipreset.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of the finalization webhook. The receiver persists {@code nip} and must use
 * {@code request_id} as idempotency key, since a retried delivery may arrive twice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({"evento", "request_id", "timestamp", "cliente_id", "contacto_record_id",
        "vehiculo_id", "vehiculo_record_id", "nip"})
public class NipFinalizationPayload {

    @JsonProperty("evento")
    private String event;

    @JsonProperty("request_id")
    private String requestId;

    /**
     * ISO-8601 instant of the confirmation.
     */
    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("cliente_id")
    private String customerId;

    @JsonProperty("contacto_record_id")
    private String contactRecordId;

    @JsonProperty("vehiculo_id")
    private String vehicleId;

    @JsonProperty("vehiculo_record_id")
    private String vehicleRecordId;

    @ToString.Exclude
    @JsonProperty("nip")
    private String nip;
}
