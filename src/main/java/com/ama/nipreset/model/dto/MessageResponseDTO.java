package com.ama.nipreset.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response body carrying a single user message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponseDTO {

    private String message;

    public static MessageResponseDTO of(String message) {
        return new MessageResponseDTO(message);
    }
}
