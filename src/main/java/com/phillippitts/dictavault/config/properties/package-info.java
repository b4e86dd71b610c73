/**
 * Typed {@code @ConfigurationProperties} bound from application.properties and validated on
 * startup.
 */
package com.phillippitts.dictavault.config.properties;
