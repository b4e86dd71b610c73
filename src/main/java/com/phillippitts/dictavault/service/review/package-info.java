/**
 * Sentence review workflow: segmentation, the per-sentence decision state machine and the
 * commit that turns decisions into content units.
 */
package com.phillippitts.dictavault.service.review;
