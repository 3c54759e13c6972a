package com.simmodel.catalog.catalog.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the best model language for a list of preferred language tags.
 *
 * Built once from the model language codes, default language first. Immutable.
 *
 * Selection order for each preferred tag:
 * - BCP 47 lookup with truncation (fr-CA matches fr),
 * - same primary language subtag (fr matches fr-CA).
 * If no preferred tag matches then the default language is returned.
 */
public final class LanguageMatcher {

    private static final Logger log = LoggerFactory.getLogger(LanguageMatcher.class);

    private final List<String> codes;
    private final List<String> normalizedTags;

    public LanguageMatcher(List<String> codes) {
        this.codes = List.copyOf(codes);
        List<String> tags = new ArrayList<>(codes.size());
        for (String code : this.codes) {
            tags.add(normalize(code));
        }
        this.normalizedTags = Collections.unmodifiableList(tags);
    }

    public List<String> getCodes() {
        return codes;
    }

    /**
     * @return default language code, empty if matcher has no languages
     */
    public Optional<String> getDefaultCode() {
        return codes.isEmpty() ? Optional.empty() : Optional.of(codes.get(0));
    }

    /**
     * Find best matching model language code.
     *
     * @param preferred preferred language tags, most preferred first, may be null or empty
     * @return matched model language code or default language, empty if matcher has no languages
     */
    public Optional<String> match(List<String> preferred) {
        if (codes.isEmpty()) {
            return Optional.empty();
        }
        if (preferred != null) {
            for (String tag : preferred) {
                Optional<String> found = matchOne(tag);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return getDefaultCode();
    }

    private Optional<String> matchOne(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String norm = normalize(tag);

        List<Locale.LanguageRange> ranges;
        try {
            ranges = Locale.LanguageRange.parse(norm);
        } catch (IllegalArgumentException e) {
            log.debug("Ignore invalid language tag: {} ({})", tag, e.getMessage());
            return Optional.empty();
        }

        String found = Locale.lookupTag(ranges, normalizedTags);
        if (found != null) {
            int idx = indexOfTag(found);
            if (idx >= 0) {
                return Optional.of(codes.get(idx));
            }
        }

        // fallback: compare primary language subtag only
        String primary = primarySubtag(norm);
        for (int k = 0; k < normalizedTags.size(); k++) {
            if (primary.equals(primarySubtag(normalizedTags.get(k)))) {
                return Optional.of(codes.get(k));
            }
        }
        return Optional.empty();
    }

    private int indexOfTag(String tag) {
        for (int k = 0; k < normalizedTags.size(); k++) {
            if (normalizedTags.get(k).equalsIgnoreCase(tag)) {
                return k;
            }
        }
        return -1;
    }

    // language codes in model stores may use underscore: en_CA
    private static String normalize(String code) {
        return code == null ? "" : code.trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }

    private static String primarySubtag(String tag) {
        int dash = tag.indexOf('-');
        return dash < 0 ? tag : tag.substring(0, dash);
    }

    @Override
    public String toString() {
        return "LanguageMatcher" + codes;
    }
}
