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
 * Request DTO for the customer lookup step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LookupRequestDTO {

    @NotBlank
    @Email
    @Size(max = 254)
    @JsonAlias("correo")
    private String email;

    @NotBlank
    @Size(max = 32)
    @JsonAlias("telefono")
    private String phone;
}
