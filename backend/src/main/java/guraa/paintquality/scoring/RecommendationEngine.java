package guraa.paintquality.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates an ordered rule table against an analysis.
 */
@Slf4j
@Component
public class RecommendationEngine {

    private final List<RecommendationRule> rules;
    private final String fallback;

    public RecommendationEngine() {
        this(RecommendationRules.defaults(), RecommendationRules.ALL_CLEAR);
    }

    /**
     * @param rules The rule table, in output order
     * @param fallback Message emitted when no rule applies, or null for none
     */
    public RecommendationEngine(List<RecommendationRule> rules, String fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    /**
     * Produce recommendations in table order.
     *
     * @param context The analysis to evaluate
     * @return The messages of every applicable rule, or the fallback
     */
    public List<String> recommend(RecommendationContext context) {
        List<String> recommendations = new ArrayList<>();
        for (RecommendationRule rule : rules) {
            if (rule.appliesTo(context)) {
                log.debug("Recommendation rule '{}' applies", rule.getId());
                recommendations.add(rule.getMessage());
            }
        }
        if (recommendations.isEmpty() && fallback != null) {
            recommendations.add(fallback);
        }
        return recommendations;
    }
}
