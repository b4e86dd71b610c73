/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code detect} - detector engine and language-model classifier</li>
 *   <li>{@code ledger} - append-only version history</li>
 *   <li>{@code privacy} - privacy levels, vault, tags and the publish gate</li>
 *   <li>{@code review} - sentence review workflow</li>
 *   <li>{@code metrics}, {@code health}, {@code events} - observability</li>
 * </ul>
 */
package com.phillippitts.dictavault.service;
