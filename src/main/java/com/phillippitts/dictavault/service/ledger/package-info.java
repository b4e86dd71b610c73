/**
 * Version ledger: append-only per-document history with restore.
 */
package com.phillippitts.dictavault.service.ledger;
