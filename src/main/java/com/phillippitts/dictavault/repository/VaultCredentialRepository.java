package com.phillippitts.dictavault.repository;

import java.util.Optional;

/**
 * Storage port for the single vault password hash.
 */
public interface VaultCredentialRepository {

    Optional<String> findPasswordHash();

    void savePasswordHash(String hash);
}
