package com.ama.nipreset.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for sending a reset link for one vehicle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SendLinkRequestDTO {

    @NotBlank
    @Email
    @Size(max = 254)
    @JsonAlias("correo")
    private String email;

    @NotBlank
    @Size(max = 32)
    @JsonAlias("telefono")
    private String phone;

    @NotBlank
    @Size(max = 64)
    @JsonAlias("cliente_id")
    private String subjectKey;

    @NotBlank
    @Size(max = 64)
    @JsonAlias("vehiculo_id")
    private String targetId;
}
