/**
 * Language-model privacy classifier: prompt, HTTP client, response parsing and the bounded
 * asynchronous runner.
 */
package com.phillippitts.dictavault.service.detect.llm;
