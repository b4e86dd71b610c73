package com.phillippitts.dictavault.service.privacy;

import com.phillippitts.dictavault.config.properties.VaultProperties;
import com.phillippitts.dictavault.exception.StorageExceptionBuilder;
import com.phillippitts.dictavault.repository.VaultCredentialRepository;
import com.phillippitts.dictavault.service.metrics.PrivacyMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Password vault: in-memory lock flag backed by a persisted BCrypt hash.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>Created locked on every process start.</li>
 *   <li>If no password was ever set the vault counts as unlocked and {@link #unlock} always
 *       succeeds.</li>
 *   <li>{@link #setPassword} stores a new hash and unlocks.</li>
 *   <li>{@link #lock} locks until the next successful {@link #unlock}.</li>
 * </ul>
 *
 * <p>A failed unlock never changes the lock flag. With {@code privacy.vault.max-failed-attempts}
 * above zero, repeated failures open a lockout window of {@code privacy.vault.lockout-ms}.
 *
 * <p>Thread-safe; all state changes are synchronized on this instance.
 */
@Component
public class VaultState {

    private static final Logger LOG = LogManager.getLogger(VaultState.class);

    private final VaultCredentialRepository credentials;
    private final PasswordEncoder encoder;
    private final PrivacyMetrics metrics;
    private final UnlockThrottle throttle;

    private boolean unlocked;

    public VaultState(VaultCredentialRepository credentials,
                      PasswordEncoder encoder,
                      VaultProperties props,
                      Clock clock,
                      PrivacyMetrics metrics) {
        this.credentials = Objects.requireNonNull(credentials);
        this.encoder = Objects.requireNonNull(encoder);
        this.metrics = Objects.requireNonNull(metrics);
        this.throttle = props.isThrottlingEnabled()
                ? new UnlockThrottle(props.getMaxFailedAttempts(),
                        Duration.ofMillis(props.getLockoutMs()), clock)
                : null;
    }

    /**
     * @return true if the password matched, or if no password is set
     */
    public synchronized boolean unlock(String password) {
        Optional<String> hash = loadHash();
        if (hash.isEmpty()) {
            unlocked = true;
            return true;
        }
        if (throttle != null && throttle.isLockedOut()) {
            LOG.warn("Vault unlock rejected: too many failed attempts");
            metrics.incrementUnlockFailure();
            return false;
        }
        if (password != null && encoder.matches(password, hash.get())) {
            unlocked = true;
            if (throttle != null) {
                throttle.recordSuccess();
            }
            LOG.info("Vault unlocked");
            return true;
        }
        if (throttle != null) {
            throttle.recordFailure();
        }
        metrics.incrementUnlockFailure();
        LOG.warn("Vault unlock failed: wrong password");
        return false;
    }

    /**
     * Stores the hash of a new password and unlocks the vault.
     *
     * @return false for a null or empty password, which leaves everything unchanged
     */
    public synchronized boolean setPassword(String password) {
        if (password == null || password.isEmpty()) {
            return false;
        }
        try {
            credentials.savePasswordHash(encoder.encode(password));
        } catch (DataAccessException e) {
            LOG.error("Failed to store vault password", e);
            throw StorageExceptionBuilder.create("Failed to store vault password")
                    .operation("setPassword")
                    .cause(e)
                    .build();
        }
        unlocked = true;
        if (throttle != null) {
            throttle.recordSuccess();
        }
        LOG.info("Vault password set");
        return true;
    }

    public synchronized void lock() {
        unlocked = false;
        LOG.info("Vault locked");
    }

    /**
     * @return true if unlocked, or if no password has ever been set
     */
    public synchronized boolean isUnlocked() {
        return unlocked || !hasPassword();
    }

    public boolean hasPassword() {
        return loadHash().isPresent();
    }

    private Optional<String> loadHash() {
        try {
            return credentials.findPasswordHash();
        } catch (DataAccessException e) {
            LOG.error("Failed to read vault password", e);
            throw StorageExceptionBuilder.create("Failed to read vault password")
                    .operation("loadPasswordHash")
                    .cause(e)
                    .build();
        }
    }
}
