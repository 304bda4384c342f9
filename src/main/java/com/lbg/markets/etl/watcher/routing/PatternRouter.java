package com.lbg.markets.etl.watcher.routing;

import com.lbg.markets.etl.watcher.domain.Destination;
import com.lbg.markets.etl.watcher.domain.PatternRule;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a file path into a destination by ordered, case-insensitive substring rules.
 * Stateless; safe to rebuild whenever the rule set changes.
 */
public class PatternRouter {

    private static final Logger LOG = Logger.getLogger(PatternRouter.class);

    private final List<PatternRule> rules;
    private final List<String> loweredPatterns;

    public PatternRouter(List<PatternRule> rules) {
        this.rules = List.copyOf(rules);
        this.loweredPatterns = this.rules.stream()
                .map(r -> PathNormalizer.forMatching(r.pattern()))
                .toList();
    }

    /**
     * First rule whose pattern occurs in the normalized path, or empty when none does.
     */
    public Optional<Destination> classify(String path) {
        String normalized = PathNormalizer.forMatching(path);
        for (int i = 0; i < rules.size(); i++) {
            if (normalized.contains(loweredPatterns.get(i))) {
                PatternRule rule = rules.get(i);
                LOG.debugf("Pattern '%s' found in %s -> %s", rule.pattern(), path, rule.destination().table());
                return Optional.of(rule.destination());
            }
        }
        LOG.debugf("No pattern matched for: %s", path);
        return Optional.empty();
    }

    public List<PatternRule> rules() {
        return rules;
    }
}
