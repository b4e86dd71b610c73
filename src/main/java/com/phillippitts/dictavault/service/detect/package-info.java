/**
 * Detector engine: regex patterns, topic keywords and an optional language-model classifier.
 *
 * <p>{@link com.phillippitts.dictavault.service.detect.PrivacyScanner} is the facade other
 * services use. Detectors hold no mutable state. Detection failures are recovered here and
 * never reach callers as exceptions.
 */
package com.phillippitts.dictavault.service.detect;
