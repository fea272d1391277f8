package guraa.paintquality.scoring;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Predicate;

/**
 * One row of the recommendation table: when the condition holds, the message is emitted.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class RecommendationRule {
    private final String id;
    private final Predicate<RecommendationContext> condition;
    private final String message;

    public static RecommendationRule of(String id, Predicate<RecommendationContext> condition, String message) {
        return new RecommendationRule(id, condition, message);
    }

    public boolean appliesTo(RecommendationContext context) {
        return condition.test(context);
    }
}
