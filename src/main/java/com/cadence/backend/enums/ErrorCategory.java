package com.cadence.backend.enums;

import java.util.Arrays;
import java.util.Locale;

/**
 * Fixed failure taxonomy reported by execution adapters. Recovery filtering
 * and the failure breakdown key on this value, never on message text.
 */
public enum ErrorCategory {
    CONNECTION_TIMEOUT("connection_timeout", "Connection Timeout",
            "The connection to the destination timed out. This often happens under heavy load. Try resetting the failed contacts to retry."),
    DESTINATION_ACCOUNT_NOT_LINKED("destination_account_not_linked", "Account Not Connected",
            "The sending account is not connected. Link the account in My Connections before retrying."),
    SESSION_EXPIRED("session_expired", "Session Expired",
            "The sending session has expired. Reconnect the account in My Connections, then reset these contacts."),
    PROXY_ERROR("proxy_error", "Proxy Connection Failed",
            "The proxy server connection failed. This is usually temporary, try resetting the failed contacts."),
    MISSING_RECIPIENT_HANDLE("missing_recipient_handle", "Missing Recipient Handle",
            "These contacts have no profile URL, address or number for this channel. Update their contact information first."),
    WARMUP_LIMIT_DEFERRED("warmup_limit_deferred", "Warmup Limit Reached",
            "Daily warmup limit reached to protect your account. These will automatically retry in the next sending window."),
    RATE_LIMITED_BY_DESTINATION("rate_limited_by_destination", "Rate Limited by Destination",
            "The destination platform is temporarily limiting requests. Wait a few hours before retrying."),
    OTHER_ERROR("other_error", "Other Error",
            "An unexpected error occurred. Try resetting and retrying these contacts."),
    UNKNOWN("unknown", "Unknown Error",
            "Unable to determine the error cause. Try resetting and retrying these contacts.");

    private final String code;
    private final String label;
    private final String recommendation;

    ErrorCategory(String code, String label, String recommendation) {
        this.code = code;
        this.label = label;
        this.recommendation = recommendation;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public String getRecommendation() {
        return recommendation;
    }

    /**
     * Resolve a taxonomy code such as {@code "session_expired"}. Enum names are accepted too.
     *
     * @throws IllegalArgumentException for codes outside the taxonomy
     */
    public static ErrorCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Error category code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown error category: " + code));
    }
}
