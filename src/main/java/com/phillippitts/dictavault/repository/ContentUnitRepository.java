package com.phillippitts.dictavault.repository;

import com.phillippitts.dictavault.domain.ContentUnit;

import java.util.List;

/**
 * Storage port for cards produced by sentence review.
 */
public interface ContentUnitRepository {

    void insert(ContentUnit unit);

    List<ContentUnit> findBySession(String sessionId);
}
