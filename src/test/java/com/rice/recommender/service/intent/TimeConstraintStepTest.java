package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.QueryIntent;
import com.rice.recommender.model.TimeBound;
import com.rice.recommender.service.embedding.DisabledEmbedder;
import com.rice.recommender.service.lexicon.Lexicon;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TimeConstraintStepTest {
    private static final Lexicon LEXICON = Lexicon.builder()
            .add(FacetCategory.TIME_CONSTRAINT, "quick", List.of("fast", "in a hurry"))
            .add(FacetCategory.TIME_CONSTRAINT, "slow", List.of("all day"))
            .build();
    private final TimeConstraintStep step = TimeConstraintStep.withDefaults(LEXICON, 30, 60);

    private ExtractionContext run(String text) {
        ExtractionContext ctx = new ExtractionContext(Arrays.asList(text.split(" ")), new DisabledEmbedder());
        step.apply(ctx);
        return ctx;
    }

    private QueryIntent intentOf(String text) {
        return run(text).intent().build();
    }

    @Test
    public void explicitUpperBounds() {
        assertEquals(TimeBound.atMost(30), intentOf("pasta under 30 minutes").getTimeBound());
        assertEquals(TimeBound.atMost(60), intentOf("less than an hour").getTimeBound());
        assertEquals(TimeBound.atMost(20), intentOf("no more than 20 mins").getTimeBound());
        assertEquals(TimeBound.atMost(90), intentOf("within ninety minutes").getTimeBound());
        assertEquals(TimeBound.atMost(30), intentOf("dinner in half an hour").getTimeBound());
    }

    @Test
    public void explicitLowerBounds() {
        assertEquals(TimeBound.atLeast(120), intentOf("at least 2 hours").getTimeBound());
        assertEquals(TimeBound.atLeast(90), intentOf("more than 90 minutes").getTimeBound());
        assertEquals(TimeBound.atLeast(60), intentOf("over 1 hr").getTimeBound());
    }

    @Test
    public void bareAmountIsACeiling() {
        QueryIntent intent = intentOf("45 minute curry");
        assertEquals(TimeBound.atMost(45), intent.getTimeBound());
        assertEquals(Set.of("max:45"), intent.values(FacetCategory.TIME_CONSTRAINT));
        assertEquals(TimeBound.atMost(30), intentOf("30min meals").getTimeBound());
        assertEquals(TimeBound.atMost(120), intentOf("2h roast").getTimeBound());
    }

    @Test
    public void amountTokensAreConsumed() {
        ExtractionContext ctx = run("chicken under 30 minutes");
        assertFalse(ctx.isConsumed(0));
        assertTrue(ctx.isConsumed(1));
        assertTrue(ctx.isConsumed(2));
        assertTrue(ctx.isConsumed(3));
    }

    @Test
    public void qualitativeTermsUseConfiguredBounds() {
        QueryIntent quick = intentOf("fast vegan desserts");
        assertEquals(Set.of("quick"), quick.values(FacetCategory.TIME_CONSTRAINT));
        assertEquals(TimeBound.atMost(30), quick.getTimeBound());
        assertEquals(TimeBound.atLeast(60), intentOf("something all day").getTimeBound());
        assertEquals(TimeBound.atMost(30), intentOf("dinner in a hurry").getTimeBound());

        TimeConstraintStep custom = TimeConstraintStep.withDefaults(LEXICON, 15, 240);
        ExtractionContext ctx = new ExtractionContext(List.of("quick", "lunch"), new DisabledEmbedder());
        custom.apply(ctx);
        assertEquals(TimeBound.atMost(15), ctx.intent().build().getTimeBound());
    }

    @Test
    public void explicitAmountWinsOverQualitativeTerm() {
        ExtractionContext ctx = run("quick dinner under 45 minutes");
        QueryIntent intent = ctx.intent().build();
        assertEquals(TimeBound.atMost(45), intent.getTimeBound());
        assertEquals(Set.of("max:45"), intent.values(FacetCategory.TIME_CONSTRAINT));
    }

    @Test
    public void noTimeMentionLeavesCategoryUnconstrained() {
        QueryIntent intent = intentOf("asian chicken");
        assertFalse(intent.isConstrained(FacetCategory.TIME_CONSTRAINT));
        assertNull(intent.getTimeBound());
        // A number without a unit is not a time
        assertNull(intentOf("3 eggs").getTimeBound());
    }

    @Test
    public void conflictingBoundsAreIntersected() {
        QueryIntent intent = intentOf("over 20 minutes under 40 minutes");
        TimeBound bound = intent.getTimeBound();
        assertEquals(Integer.valueOf(40), bound.getMaxMinutes());
        assertEquals(Integer.valueOf(20), bound.getMinMinutes());
        assertTrue(bound.satisfiedBy(30));
        assertFalse(bound.satisfiedBy(45));
    }
}
