package com.phillippitts.dictavault.service.privacy;

import com.phillippitts.dictavault.domain.PrivacyLevel;
import com.phillippitts.dictavault.domain.PublishReadiness;

import java.util.Collection;
import java.util.List;

/**
 * Privacy levels of sessions and cards, the vault, and the gates built on them.
 *
 * <p>An entity without a stored level is {@link PrivacyLevel#PUBLIC}. Read operations have no
 * side effects; a level write touches only that entity.
 */
public interface PrivacyStateStore {

    PrivacyLevel getLevel(String entityId);

    void setLevel(String entityId, PrivacyLevel level);

    /**
     * Sets the same level on every id, in iteration order.
     */
    void setLevel(Collection<String> entityIds, PrivacyLevel level);

    /**
     * @return true iff the entity is public
     */
    boolean canUseExternalAPI(String entityId);

    /**
     * @return true iff every listed entity is public (true for an empty collection)
     */
    boolean canUseExternalAPI(Collection<String> entityIds);

    /**
     * @return true iff the entity is public and has no unreviewed privacy tags
     */
    boolean canPublish(String entityId);

    /**
     * Evaluates the publish gate. Blockers, in order: the session is private; any listed card
     * is private; the vault is locked while a password exists.
     */
    PublishReadiness checkPublishReady(String sessionId, Collection<String> cardIds);

    List<String> getPrivateEntityIds();

    int privateEntityCount();

    boolean unlockVault(String password);

    void lockVault();

    boolean setPassword(String password);

    boolean hasPassword();

    boolean isVaultUnlocked();
}
