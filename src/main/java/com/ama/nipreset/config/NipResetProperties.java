package com.ama.nipreset.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the NIP reset service.
 */
@Data
@ConfigurationProperties(prefix = "ama.nip-reset")
public class NipResetProperties {

    /**
     * Name reported by the health endpoint
     */
    private String serviceName = "ama-reset-nip-api";

    /**
     * Reset token configuration
     */
    private TokenConfig token = new TokenConfig();

    /**
     * Per-subject issuance rate limit
     */
    private RateLimitConfig rateLimit = new RateLimitConfig();

    /**
     * Finalization webhook configuration
     */
    private WebhookConfig webhook = new WebhookConfig();

    /**
     * Identity directory configuration
     */
    private DirectoryConfig directory = new DirectoryConfig();

    /**
     * Mail relay configuration
     */
    private MailConfig mail = new MailConfig();

    /**
     * HTTP surface configuration
     */
    private HttpConfig http = new HttpConfig();

    @Data
    public static class TokenConfig {
        /**
         * Minutes a reset link stays valid
         */
        private int ttlMinutes = 30;

        /**
         * Random bytes in each reset secret (32 bytes = 256 bits)
         */
        private int secretBytes = 32;

        /**
         * Attempts to persist a token before giving up on write conflicts
         */
        private int maxIssueAttempts = 3;
    }

    @Data
    public static class RateLimitConfig {
        /**
         * Trailing window in minutes
         */
        private int windowMinutes = 60;

        /**
         * Tokens allowed per customer + vehicle inside the window
         */
        private int maxRequests = 2;
    }

    @Data
    public static class WebhookConfig {
        /**
         * Receiver URL that persists the new NIP
         */
        private String url;

        /**
         * Shared HMAC secret. In production use environment variable: NIP_WEBHOOK_SECRET
         */
        private String secret;

        /**
         * Event name sent in the payload and the X-Webhook-Event header
         */
        private String eventName = "nip.reset.confirmed";

        /**
         * Total delivery attempts
         */
        private int attempts = 2;

        /**
         * Delay between attempts in milliseconds
         */
        private long retryDelayMs = 500;

        /**
         * Per-attempt timeout in seconds
         */
        private int timeoutSeconds = 5;
    }

    @Data
    public static class DirectoryConfig {
        /**
         * Identity directory API base URL
         */
        private String apiUrl = "http://localhost:9700";

        /**
         * API key for service-to-service authentication
         */
        private String apiKey;

        /**
         * Request timeout in seconds
         */
        private int timeoutSeconds = 10;
    }

    @Data
    public static class MailConfig {
        /**
         * Mail relay API base URL
         */
        private String apiUrl = "http://localhost:9800";

        /**
         * Bearer key for the relay
         */
        private String apiKey;

        /**
         * Sender address
         */
        private String from = "no-reply@ama.mx";

        /**
         * Subject line of the reset email
         */
        private String subject = "Reinicio de NIP";

        /**
         * Frontend page that receives the token as query parameter
         */
        private String linkBaseUrl = "http://localhost:5173/reset-nip";

        /**
         * Request timeout in seconds
         */
        private int timeoutSeconds = 10;
    }

    @Data
    public static class HttpConfig {
        /**
         * Origins allowed by CORS. Empty list rejects browser origins.
         */
        private List<String> allowedOrigins = new ArrayList<>();

        /**
         * Largest accepted request body in bytes
         */
        private long maxBodyBytes = 10 * 1024;
    }
}
