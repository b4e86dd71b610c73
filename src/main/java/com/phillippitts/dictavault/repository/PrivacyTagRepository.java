package com.phillippitts.dictavault.repository;

import com.phillippitts.dictavault.domain.PrivacyTag;
import com.phillippitts.dictavault.domain.TagStatus;

import java.util.List;

/**
 * Storage port for persisted privacy tags.
 */
public interface PrivacyTagRepository {

    void insertAll(List<PrivacyTag> tags);

    /**
     * @return tags of the session ordered by start offset
     */
    List<PrivacyTag> findBySession(String sessionId);

    boolean existsForSession(String sessionId);

    /**
     * @return true if a tag with this id existed and was updated
     */
    boolean updateStatus(String tagId, TagStatus status);

    int countBySessionAndStatus(String sessionId, TagStatus status);

    int deleteBySession(String sessionId);
}
