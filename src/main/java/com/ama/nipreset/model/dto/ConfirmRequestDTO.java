package com.ama.nipreset.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for confirming a new NIP with a reset token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfirmRequestDTO {

    @NotBlank
    @Size(max = 128)
    private String token;

    @NotBlank
    @Pattern(regexp = "\\d{4}")
    @JsonAlias("nip")
    private String newSecret;

    @NotBlank
    @Pattern(regexp = "\\d{4}")
    @JsonAlias("nip_confirmacion")
    private String newSecretConfirmation;

    @Override
    public String toString() {
        return "ConfirmRequestDTO(token=***, newSecret=***, newSecretConfirmation=***)";
    }
}
