/**
 * Domain models for privacy classification and the version ledger.
 *
 * <p>All domain models are immutable records or enums, validate themselves in their
 * constructors and carry no persistence annotations.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.dictavault.domain.Match} - transient detected span</li>
 *   <li>{@link com.phillippitts.dictavault.domain.PrivacyTag} - persisted, reviewable span</li>
 *   <li>{@link com.phillippitts.dictavault.domain.PrivacyLevel} - public/private gate value</li>
 *   <li>{@link com.phillippitts.dictavault.domain.Version} - append-only document history entry</li>
 *   <li>{@link com.phillippitts.dictavault.domain.ContentUnit} - card created by sentence review</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.dictavault.domain;
