/**
 * Privacy state: per-entity levels, the password vault, persisted privacy tags and the
 * publish gate.
 *
 * <p>Every publish or external-API path is expected to consult
 * {@link com.phillippitts.dictavault.service.privacy.PrivacyStateStore} first. Storage failures
 * propagate as {@link com.phillippitts.dictavault.exception.StorageException}.
 */
package com.phillippitts.dictavault.service.privacy;
