package com.ama.nipreset.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A vehicle the customer may reset the NIP for.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TargetDTO {

    private String targetId;

    private String label;
}
