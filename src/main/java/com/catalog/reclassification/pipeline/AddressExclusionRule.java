package com.catalog.reclassification.pipeline;

import com.catalog.reclassification.core.model.CatalogEntry;
import com.catalog.reclassification.core.model.DecisionSource;
import com.catalog.reclassification.core.model.Record;
import com.catalog.reclassification.core.model.RecordAction;
import com.catalog.reclassification.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Fixed override: a record whose address names a shopping mall, store or unit number is
 * excluded, whatever an earlier stage decided. Runs after every other stage and never
 * touches the category.
 */
public class AddressExclusionRule extends RecordStage {
    private static final Logger log = LoggerFactory.getLogger(AddressExclusionRule.class);

    static final double CONFIDENCE = 1.0;

    private final NormalizationEngine engine;
    private final Pattern pattern;

    public AddressExclusionRule(NormalizationEngine engine, List<String> keywords) {
        this.engine = engine;
        this.pattern = compile(engine, keywords);
    }

    @Override
    public String getName() {
        return "rule-address";
    }

    @Override
    protected boolean accepts(Record record) {
        return pattern != null;
    }

    @Override
    protected boolean process(Record record) {
        if (!matches(record.getAddress())) {
            return false;
        }
        RecordAction previous = record.getAction();
        record.applyDecision(CatalogEntry.EXCLUSION_SENTINEL, RecordAction.EXCLUDE,
                DecisionSource.RULE_ADDRESS, CONFIDENCE);
        log.debug("rule.address.excluded id='{}' previousAction={}", record.getId(), previous);
        return true;
    }

    /**
     * Returns true if the address contains one of the keywords as a whole word.
     */
    public boolean matches(String address) {
        return pattern != null && pattern.matcher(engine.normalize(address)).find();
    }

    private static Pattern compile(NormalizationEngine engine, List<String> keywords) {
        StringJoiner alternatives = new StringJoiner("|", "\\b(?:", ")\\b");
        int count = 0;
        for (String keyword : keywords) {
            String normalized = engine.normalize(keyword);
            if (!normalized.isEmpty()) {
                alternatives.add(Pattern.quote(normalized));
                count++;
            }
        }
        if (count == 0) {
            return null;
        }
        return Pattern.compile(alternatives.toString(),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    }
}
