package com.ama.nipreset.model.dto;

/**
 * Fixed user-facing messages. Never carry technical detail.
 */
public final class ApiMessages {

    public static final String WRONG_DATA = "Datos incorrectos";
    public static final String LINK_SENT = "Hemos enviado al correo registrado la URL para reiniciar tu NIP.";
    public static final String TOO_MANY_REQUESTS = "Demasiadas solicitudes. Intenta mas tarde.";
    public static final String INVALID_LINK = "Liga invalida o expirada.";
    public static final String NIP_MISMATCH = "Los NIP no coinciden.";
    public static final String INVALID_INPUT = "Datos invalidos.";
    public static final String SERVICE_UNAVAILABLE = "Servicio no disponible. Intenta mas tarde.";
    public static final String NIP_UPDATED = "Listo. Tu NIP fue actualizado.";
    public static final String REQUEST_FAILED = "No fue posible completar la solicitud.";
    public static final String PAYLOAD_TOO_LARGE = "Solicitud demasiado grande.";
    public static final String LENGTH_REQUIRED = "La solicitud debe declarar su longitud.";

    private ApiMessages() {
    }
}
