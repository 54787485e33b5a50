package com.rice.recommender.service.intent;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.model.TimeBound;
import com.rice.recommender.service.lexicon.Lexicon;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cooking time detection.
 *
 * <p>Explicit amounts win: "under 30 minutes", "less than an hour", "at least 2 hours",
 * "45 min". A bare amount is read as an upper bound. Only when no amount is present are
 * qualitative lexicon terms consulted: values of the time category resolve through the
 * configured label bounds (by default {@code quick} to a ceiling and {@code slow} to a
 * floor).
 */
public class TimeConstraintStep implements FacetStep {
    private static final Pattern NUMBER = Pattern.compile("\\d{1,4}");
    private static final Pattern COMPACT = Pattern.compile("(\\d{1,4})(m|min|mins|minute|minutes|h|hr|hrs|hour|hours)");

    private static final Set<String> MINUTE_UNITS = Set.of("min", "mins", "minute", "minutes");
    private static final Set<String> HOUR_UNITS = Set.of("h", "hr", "hrs", "hour", "hours");

    private static final Map<String, Integer> WORD_NUMBERS = Map.ofEntries(
            Map.entry("a", 1), Map.entry("an", 1), Map.entry("one", 1), Map.entry("two", 2),
            Map.entry("three", 3), Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6),
            Map.entry("ten", 10), Map.entry("fifteen", 15), Map.entry("twenty", 20),
            Map.entry("thirty", 30), Map.entry("forty", 40), Map.entry("fifty", 50),
            Map.entry("sixty", 60), Map.entry("ninety", 90)
    );

    /** Qualifier phrases, longest first so "no more than" is not read as "more than". */
    private static final List<Qualifier> QUALIFIERS = List.of(
            new Qualifier(List.of("no", "more", "than"), true),
            new Qualifier(List.of("not", "more", "than"), true),
            new Qualifier(List.of("less", "than"), true),
            new Qualifier(List.of("fewer", "than"), true),
            new Qualifier(List.of("at", "most"), true),
            new Qualifier(List.of("up", "to"), true),
            new Qualifier(List.of("more", "than"), false),
            new Qualifier(List.of("longer", "than"), false),
            new Qualifier(List.of("at", "least"), false),
            new Qualifier(List.of("under"), true),
            new Qualifier(List.of("within"), true),
            new Qualifier(List.of("below"), true),
            new Qualifier(List.of("max"), true),
            new Qualifier(List.of("maximum"), true),
            new Qualifier(List.of("in"), true),
            new Qualifier(List.of("over"), false),
            new Qualifier(List.of("above"), false),
            new Qualifier(List.of("minimum"), false)
    );

    private record Qualifier(List<String> words, boolean upper) {}

    private record Amount(int minutes, int from, int to) {}

    private final Lexicon lexicon;
    private final Map<String, TimeBound> labelBounds;

    /**
     * @param labelBounds bound per canonical time value of the lexicon, e.g. quick to at most 30
     */
    public TimeConstraintStep(Lexicon lexicon, Map<String, TimeBound> labelBounds) {
        this.lexicon = lexicon;
        this.labelBounds = Map.copyOf(labelBounds);
    }

    public static TimeConstraintStep withDefaults(Lexicon lexicon, int quickCeilingMinutes, int slowFloorMinutes) {
        return new TimeConstraintStep(lexicon, Map.of(
                "quick", TimeBound.atMost(quickCeilingMinutes),
                "slow", TimeBound.atLeast(slowFloorMinutes)));
    }

    @Override
    public boolean supports(ExtractionContext context) {
        return !context.tokens().isEmpty();
    }

    @Override
    public void apply(ExtractionContext context) {
        if (applyExplicitAmounts(context)) return;
        for (LexicalScanner.Hit hit : LexicalScanner.scan(context, lexicon, FacetCategory.TIME_CONSTRAINT)) {
            TimeBound bound = labelBounds.get(hit.canonical());
            if (bound != null) context.intent().addTime(hit.canonical(), bound);
        }
    }

    private boolean applyExplicitAmounts(ExtractionContext context) {
        List<String> tokens = context.tokens();
        boolean found = false;
        for (int i = 0; i < tokens.size(); i++) {
            if (context.isConsumed(i)) continue;
            Amount amount = readAmount(tokens, i);
            if (amount == null || !context.isFree(amount.from(), amount.to())) continue;

            int start = amount.from();
            boolean upper = true;
            for (Qualifier q : QUALIFIERS) {
                int qs = start - q.words().size();
                if (qs >= 0 && context.isFree(qs, start) && tokens.subList(qs, start).equals(q.words())) {
                    upper = q.upper();
                    start = qs;
                    break;
                }
            }
            context.consume(start, amount.to());
            TimeBound bound = upper ? TimeBound.atMost(amount.minutes()) : TimeBound.atLeast(amount.minutes());
            context.intent().addTime((upper ? "max:" : "min:") + amount.minutes(), bound);
            found = true;
            i = amount.to() - 1;
        }
        return found;
    }

    /** Reads "30 minutes", "2 hours", "30min", "an hour", "half an hour" starting at {@code i}. */
    private static Amount readAmount(List<String> tokens, int i) {
        String t = tokens.get(i);
        Matcher compact = COMPACT.matcher(t);
        if (compact.matches()) {
            int n = Integer.parseInt(compact.group(1));
            return new Amount(HOUR_UNITS.contains(compact.group(2)) ? n * 60 : n, i, i + 1);
        }
        if (t.equals("half") && i + 2 < tokens.size()
                && (tokens.get(i + 1).equals("an") || tokens.get(i + 1).equals("a"))
                && HOUR_UNITS.contains(tokens.get(i + 2))) {
            return new Amount(30, i, i + 3);
        }
        Integer n = null;
        if (NUMBER.matcher(t).matches()) n = Integer.parseInt(t);
        else if (WORD_NUMBERS.containsKey(t)) n = WORD_NUMBERS.get(t);
        if (n == null || i + 1 >= tokens.size()) return null;
        String unit = tokens.get(i + 1);
        if (MINUTE_UNITS.contains(unit)) return new Amount(n, i, i + 2);
        if (HOUR_UNITS.contains(unit)) return new Amount(n * 60, i, i + 2);
        return null;
    }
}
