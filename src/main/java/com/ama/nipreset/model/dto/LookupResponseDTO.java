package com.ama.nipreset.model.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the customer lookup step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LookupResponseDTO {

    public static final String STEP_SINGLE_TARGET = "confirmar_vehiculo_unico";
    public static final String STEP_SELECT_TARGET = "seleccionar_vehiculo";

    /**
     * Next UI step: {@value #STEP_SINGLE_TARGET} or {@value #STEP_SELECT_TARGET}.
     */
    private String step;

    /**
     * Customer identifier to send back with send-link.
     */
    private String subjectKey;

    private List<TargetDTO> targets;
}
