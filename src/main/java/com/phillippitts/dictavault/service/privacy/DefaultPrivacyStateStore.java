package com.phillippitts.dictavault.service.privacy;

import com.phillippitts.dictavault.domain.PrivacyLevel;
import com.phillippitts.dictavault.domain.PublishReadiness;
import com.phillippitts.dictavault.domain.TagStatus;
import com.phillippitts.dictavault.exception.StorageExceptionBuilder;
import com.phillippitts.dictavault.repository.PrivacyLevelRepository;
import com.phillippitts.dictavault.repository.PrivacyTagRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link PrivacyStateStore} backed by the privacy level and tag repositories and
 * {@link VaultState}.
 */
@Service
public class DefaultPrivacyStateStore implements PrivacyStateStore {

    private static final Logger LOG = LogManager.getLogger(DefaultPrivacyStateStore.class);

    static final String BLOCKER_SESSION_PRIVATE = "Session is marked as private";
    static final String BLOCKER_CARDS_PRIVATE = "%d card(s) marked as private";
    static final String BLOCKER_VAULT_LOCKED = "Vault is locked - unlock to verify private content";

    private final PrivacyLevelRepository levels;
    private final PrivacyTagRepository tags;
    private final VaultState vault;

    public DefaultPrivacyStateStore(PrivacyLevelRepository levels,
                                    PrivacyTagRepository tags,
                                    VaultState vault) {
        this.levels = Objects.requireNonNull(levels);
        this.tags = Objects.requireNonNull(tags);
        this.vault = Objects.requireNonNull(vault);
    }

    @Override
    public PrivacyLevel getLevel(String entityId) {
        requireId(entityId);
        return read("getLevel", () -> levels.find(entityId).orElse(PrivacyLevel.DEFAULT));
    }

    @Override
    public void setLevel(String entityId, PrivacyLevel level) {
        requireId(entityId);
        Objects.requireNonNull(level, "level must not be null");
        try {
            levels.save(entityId, level);
        } catch (DataAccessException e) {
            LOG.error("Failed to store privacy level {}", level, e);
            throw StorageExceptionBuilder.create("Failed to store privacy level")
                    .operation("setLevel")
                    .cause(e)
                    .metadata("entityId", entityId)
                    .metadata("level", level.storageValue())
                    .build();
        }
        LOG.debug("Privacy level of {} set to {}", entityId, level);
    }

    @Override
    public void setLevel(Collection<String> entityIds, PrivacyLevel level) {
        Objects.requireNonNull(entityIds, "entityIds must not be null");
        for (String id : entityIds) {
            setLevel(id, level);
        }
    }

    @Override
    public boolean canUseExternalAPI(String entityId) {
        return getLevel(entityId) == PrivacyLevel.PUBLIC;
    }

    @Override
    public boolean canUseExternalAPI(Collection<String> entityIds) {
        Objects.requireNonNull(entityIds, "entityIds must not be null");
        if (entityIds.isEmpty()) {
            return true;
        }
        return read("canUseExternalAPI", () -> levels.findPrivateAmong(new HashSet<>(entityIds)).isEmpty());
    }

    @Override
    public boolean canPublish(String entityId) {
        if (!canUseExternalAPI(entityId)) {
            return false;
        }
        int unreviewed = read("canPublish",
                () -> tags.countBySessionAndStatus(entityId, TagStatus.UNREVIEWED));
        return unreviewed == 0;
    }

    @Override
    public PublishReadiness checkPublishReady(String sessionId, Collection<String> cardIds) {
        requireId(sessionId);
        List<String> blockers = new ArrayList<>(3);

        if (getLevel(sessionId) == PrivacyLevel.PRIVATE) {
            blockers.add(BLOCKER_SESSION_PRIVATE);
        }

        if (cardIds != null && !cardIds.isEmpty()) {
            Set<String> privateCards = new HashSet<>(
                    read("checkPublishReady", () -> levels.findPrivateAmong(new HashSet<>(cardIds))));
            long privateCount = cardIds.stream().filter(privateCards::contains).count();
            if (privateCount > 0) {
                blockers.add(String.format(BLOCKER_CARDS_PRIVATE, privateCount));
            }
        }

        if (vault.hasPassword() && !vault.isUnlocked()) {
            blockers.add(BLOCKER_VAULT_LOCKED);
        }

        return PublishReadiness.of(blockers);
    }

    @Override
    public List<String> getPrivateEntityIds() {
        return read("getPrivateEntityIds", levels::findAllPrivateEntityIds);
    }

    @Override
    public int privateEntityCount() {
        return getPrivateEntityIds().size();
    }

    @Override
    public boolean unlockVault(String password) {
        return vault.unlock(password);
    }

    @Override
    public void lockVault() {
        vault.lock();
    }

    @Override
    public boolean setPassword(String password) {
        return vault.setPassword(password);
    }

    @Override
    public boolean hasPassword() {
        return vault.hasPassword();
    }

    @Override
    public boolean isVaultUnlocked() {
        return vault.isUnlocked();
    }

    private static <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            LOG.error("Privacy state read {} failed", operation, e);
            throw StorageExceptionBuilder.create("Failed to read privacy state")
                    .operation(operation)
                    .cause(e)
                    .build();
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("entity id must not be blank");
        }
    }
}
