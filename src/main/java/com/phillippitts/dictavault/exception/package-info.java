/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.dictavault.exception.DictaVaultException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.dictavault.exception.DetectionException} - A detector pattern
 *       failed to compile; the pattern is skipped, the scan continues</li>
 *   <li>{@link com.phillippitts.dictavault.exception.ClassifierUnavailableException} - The
 *       language-model classifier failed; detection degrades to rule-based results</li>
 *   <li>{@link com.phillippitts.dictavault.exception.VersionNotFoundException} - Restore of a
 *       version that does not exist; surfaced to the caller</li>
 *   <li>{@link com.phillippitts.dictavault.exception.StorageException} - Any persistence
 *       failure; surfaced to the caller</li>
 * </ul>
 *
 * <p>Detection-layer failures are always recovered locally. Ledger and state-store failures
 * propagate, because a lost version or privacy decision must never go unnoticed.
 *
 * @since 1.0
 */
package com.phillippitts.dictavault.exception;
