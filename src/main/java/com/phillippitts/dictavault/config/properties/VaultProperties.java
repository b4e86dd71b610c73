package com.phillippitts.dictavault.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the password vault.
 */
@Validated
@ConfigurationProperties(prefix = "privacy.vault")
public class VaultProperties {

    /** BCrypt log rounds. */
    @Min(4)
    @Max(31)
    private final int bcryptStrength;

    /**
     * Consecutive failed unlock attempts before a lockout window starts.
     * Set to 0 to disable throttling.
     */
    @Min(0)
    private final int maxFailedAttempts;

    @Min(0)
    private final long lockoutMs;

    @ConstructorBinding
    public VaultProperties(Integer bcryptStrength, Integer maxFailedAttempts, Long lockoutMs) {
        this.bcryptStrength = bcryptStrength == null ? 10 : bcryptStrength;
        this.maxFailedAttempts = maxFailedAttempts == null ? 0 : maxFailedAttempts;
        this.lockoutMs = lockoutMs == null ? 30_000L : lockoutMs;
    }

    public VaultProperties() {
        this(null, null, null);
    }

    public int getBcryptStrength() {
        return bcryptStrength;
    }

    public int getMaxFailedAttempts() {
        return maxFailedAttempts;
    }

    public long getLockoutMs() {
        return lockoutMs;
    }

    public boolean isThrottlingEnabled() {
        return maxFailedAttempts > 0;
    }
}
