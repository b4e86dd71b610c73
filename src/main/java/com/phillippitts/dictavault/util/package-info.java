/**
 * Small stateless helpers shared across services.
 */
package com.phillippitts.dictavault.util;
