package com.phillippitts.dictavault.repository;

import com.phillippitts.dictavault.domain.PrivacyLevel;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for per-entity privacy levels. A missing row means {@link PrivacyLevel#DEFAULT}.
 */
public interface PrivacyLevelRepository {

    Optional<PrivacyLevel> find(String entityId);

    /**
     * Returns the stored private entities among {@code entityIds}.
     */
    List<String> findPrivateAmong(Collection<String> entityIds);

    void save(String entityId, PrivacyLevel level);

    List<String> findAllPrivateEntityIds();
}
