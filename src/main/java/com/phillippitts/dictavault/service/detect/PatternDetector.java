package com.phillippitts.dictavault.service.detect;

import com.phillippitts.dictavault.domain.Match;
import com.phillippitts.dictavault.exception.DetectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Regular-expression detector for structured personal data (SSN, card numbers, e-mail, ...).
 *
 * <p>The built-in table is applied in a fixed order and can be extended with extra
 * category/regex pairs. Patterns are compiled once at construction; an entry that does not
 * compile is skipped and recorded as a {@link DetectionException} instead of failing the
 * detector. Instances are immutable and thread-safe.
 */
public final class PatternDetector {

    private static final Logger LOG = LogManager.getLogger(PatternDetector.class);

    /** Built-in category name to regex, in evaluation order. */
    static final Map<String, String> BUILT_IN_PATTERNS;

    static {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("SSN", "\\d{3}-\\d{2}-\\d{4}");
        patterns.put("Credit Card", "\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}");
        patterns.put("Email", "\\w+@\\w+\\.\\w+");
        patterns.put("Phone", "\\(?\\d{3}\\)?[\\s-]?\\d{3}[\\s-]?\\d{4}");
        patterns.put("IP Address", "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}");
        // Amounts with a currency symbol: £4,000, $50, € 100
        patterns.put("Currency", "[£$€]\\s?\\d[\\d,.]*");
        // Amounts in words: 50 quid, 3 grand, 20k
        patterns.put("Money Words", "\\d[\\d,.]*\\s*(pounds?|dollars?|euros?|quid|grand|k\\b)");
        BUILT_IN_PATTERNS = Collections.unmodifiableMap(patterns);
    }

    private final Map<String, Pattern> compiled;
    private final List<DetectionException> compileErrors;

    /**
     * Creates a detector with only the built-in patterns.
     */
    public PatternDetector() {
        this(Map.of());
    }

    /**
     * Creates a detector with the built-in patterns followed by {@code extraPatterns}.
     * An extra entry whose name collides with a built-in category replaces that pattern.
     *
     * @param extraPatterns category name to regex; may be empty
     */
    public PatternDetector(Map<String, String> extraPatterns) {
        Objects.requireNonNull(extraPatterns, "extraPatterns must not be null");
        Map<String, String> table = new LinkedHashMap<>(BUILT_IN_PATTERNS);
        table.putAll(extraPatterns);

        Map<String, Pattern> ok = new LinkedHashMap<>();
        List<DetectionException> errors = new ArrayList<>();
        for (Map.Entry<String, String> entry : table.entrySet()) {
            try {
                ok.put(entry.getKey(), Pattern.compile(entry.getValue()));
            } catch (PatternSyntaxException e) {
                DetectionException de = new DetectionException(entry.getKey(), e);
                errors.add(de);
                LOG.warn("Skipping detection pattern '{}': {}", entry.getKey(), e.getDescription());
            }
        }
        this.compiled = Collections.unmodifiableMap(ok);
        this.compileErrors = List.copyOf(errors);
    }

    /**
     * Applies every pattern to {@code text}.
     *
     * @return matches sorted by start offset; pattern table order breaks ties
     */
    public List<Match> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Match> matches = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : compiled.entrySet()) {
            Matcher m = entry.getValue().matcher(text);
            while (m.find()) {
                if (m.end() <= m.start()) {
                    continue; // zero-width
                }
                matches.add(Match.of(entry.getKey(), m.group(), m.start(), m.end()));
            }
        }
        matches.sort(Comparator.comparingInt(Match::startOffset));
        return matches;
    }

    /**
     * Category names that compiled successfully, in evaluation order.
     */
    public List<String> categories() {
        return List.copyOf(compiled.keySet());
    }

    /**
     * Patterns that were skipped because they did not compile.
     */
    public List<DetectionException> compileErrors() {
        return compileErrors;
    }
}
