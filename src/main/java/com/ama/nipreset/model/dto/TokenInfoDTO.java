package com.ama.nipreset.model.dto;

import com.ama.nipreset.model.domain.ResetToken;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the reset page may show about a valid link. Never contains the token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenInfoDTO {

    private String subjectKey;

    private String targetId;

    private String label;

    /**
     * Create from entity.
     */
    public static TokenInfoDTO fromEntity(ResetToken token) {
        return TokenInfoDTO.builder()
                .subjectKey(token.getCustomerId())
                .targetId(token.getVehicleId())
                .label(token.getVehicleLabel())
                .build();
    }
}
