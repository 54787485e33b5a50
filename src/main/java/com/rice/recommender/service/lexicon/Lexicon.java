package com.rice.recommender.service.lexicon;

import com.rice.recommender.model.FacetCategory;
import com.rice.recommender.util.TextUtils;

import java.util.*;

/**
 * Immutable vocabulary for intent extraction.
 *
 * <p>Holds, per {@link FacetCategory}, the canonical values and the surface forms that
 * resolve onto them, the reference phrases used for semantic matching, and the filler
 * phrases stripped before matching. Surface forms and filler phrases are stored in the
 * simplified form produced by {@link TextUtils#simplify(String)} so that lookups can use
 * space-joined token n-grams directly.
 *
 * <p>A canonical value belongs to exactly one category. {@link Builder#add} rejects a
 * value already owned by another category; {@link Builder#tryAdd} skips it instead.
 */
public final class Lexicon {
    private final Map<FacetCategory, Map<String, String>> surfaceToCanonical;
    private final Map<FacetCategory, Map<String, Set<String>>> synonyms;
    private final Map<FacetCategory, Map<String, String>> references;
    private final Map<String, FacetCategory> owner;
    private final List<String> fillerPhrases;
    private final Set<String> stopwords;
    private final Map<FacetCategory, List<String>> tagKeywords;

    private Lexicon(Builder b) {
        EnumMap<FacetCategory, Map<String, String>> s2c = new EnumMap<>(FacetCategory.class);
        EnumMap<FacetCategory, Map<String, Set<String>>> syn = new EnumMap<>(FacetCategory.class);
        EnumMap<FacetCategory, Map<String, String>> refs = new EnumMap<>(FacetCategory.class);
        EnumMap<FacetCategory, List<String>> kw = new EnumMap<>(FacetCategory.class);
        for (FacetCategory c : FacetCategory.values()) {
            s2c.put(c, Collections.unmodifiableMap(new HashMap<>(b.surfaceToCanonical.get(c))));
            Map<String, Set<String>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, LinkedHashSet<String>> e : b.synonyms.get(c).entrySet()) {
                frozen.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
            }
            syn.put(c, Collections.unmodifiableMap(frozen));
            refs.put(c, Collections.unmodifiableMap(new LinkedHashMap<>(b.references.get(c))));
            kw.put(c, List.copyOf(b.tagKeywords.get(c)));
        }
        this.surfaceToCanonical = Collections.unmodifiableMap(s2c);
        this.synonyms = Collections.unmodifiableMap(syn);
        this.references = Collections.unmodifiableMap(refs);
        this.tagKeywords = Collections.unmodifiableMap(kw);
        this.owner = Collections.unmodifiableMap(new HashMap<>(b.owner));
        this.stopwords = Collections.unmodifiableSet(new HashSet<>(b.stopwords));

        // Longest first so "i would like" is removed before "like" could break it apart
        List<String> fillers = new ArrayList<>(new LinkedHashSet<>(b.fillerPhrases));
        fillers.sort(Comparator.comparingInt((String f) -> f.split(" ").length).reversed()
                .thenComparing(Comparator.comparingInt(String::length).reversed())
                .thenComparing(Comparator.naturalOrder()));
        this.fillerPhrases = List.copyOf(fillers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Lexicon empty() {
        return new Builder().build();
    }

    /** Canonical value for a simplified surface form (single token or space-joined n-gram). */
    public Optional<String> lookup(FacetCategory category, String surface) {
        if (surface == null) return Optional.empty();
        return Optional.ofNullable(surfaceToCanonical.get(category).get(surface));
    }

    public Set<String> canonicalValues(FacetCategory category) {
        return synonyms.get(category).keySet();
    }

    /** Surface forms (including the canonical itself) for a canonical value. */
    public Set<String> synonymsOf(FacetCategory category, String canonical) {
        return synonyms.get(category).getOrDefault(canonical, Set.of());
    }

    public Optional<FacetCategory> categoryOf(String canonical) {
        return Optional.ofNullable(owner.get(canonical));
    }

    /**
     * Phrase embedded for semantic comparison of a canonical value: the configured reference
     * when present, else the canonical value and its synonyms joined.
     */
    public String referencePhrase(FacetCategory category, String canonical) {
        String ref = references.get(category).get(canonical);
        if (ref != null) return ref;
        return String.join(" ", synonymsOf(category, canonical));
    }

    /** Filler phrases, simplified, longest first. */
    public List<String> fillerPhrases() {
        return fillerPhrases;
    }

    public Set<String> stopwords() {
        return stopwords;
    }

    /** Keywords that classify dataset tags into a category when augmenting from a dataset. */
    public List<String> tagKeywords(FacetCategory category) {
        return tagKeywords.get(category);
    }

    public int size(FacetCategory category) {
        return synonyms.get(category).size();
    }

    /** Builder pre-populated with this lexicon's content, for dataset augmentation. */
    public Builder toBuilder() {
        Builder b = new Builder();
        for (FacetCategory c : FacetCategory.values()) {
            for (Map.Entry<String, Set<String>> e : synonyms.get(c).entrySet()) {
                b.add(c, e.getKey(), e.getValue());
            }
            b.references.get(c).putAll(references.get(c));
            b.tagKeywords.get(c).addAll(tagKeywords.get(c));
        }
        b.fillerPhrases.addAll(fillerPhrases);
        b.stopwords.addAll(stopwords);
        return b;
    }

    public static final class Builder {
        private final EnumMap<FacetCategory, Map<String, String>> surfaceToCanonical = new EnumMap<>(FacetCategory.class);
        private final EnumMap<FacetCategory, Map<String, LinkedHashSet<String>>> synonyms = new EnumMap<>(FacetCategory.class);
        private final EnumMap<FacetCategory, Map<String, String>> references = new EnumMap<>(FacetCategory.class);
        private final EnumMap<FacetCategory, List<String>> tagKeywords = new EnumMap<>(FacetCategory.class);
        private final Map<String, FacetCategory> owner = new HashMap<>();
        private final List<String> fillerPhrases = new ArrayList<>();
        private final Set<String> stopwords = new HashSet<>();

        private Builder() {
            for (FacetCategory c : FacetCategory.values()) {
                surfaceToCanonical.put(c, new HashMap<>());
                synonyms.put(c, new LinkedHashMap<>());
                references.put(c, new LinkedHashMap<>());
                tagKeywords.put(c, new ArrayList<>());
            }
        }

        /**
         * Registers a canonical value with its surface forms.
         *
         * @throws IllegalArgumentException if the value already belongs to another category
         */
        public Builder add(FacetCategory category, String canonical, Collection<String> surfaces) {
            if (!tryAdd(category, canonical, surfaces)) {
                throw new IllegalArgumentException("value '" + canonical + "' already belongs to "
                        + owner.get(normalizeCanonical(canonical)).key() + ", cannot add it to " + category.key());
            }
            return this;
        }

        /**
         * Same as {@link #add} but returns false instead of throwing when the value is owned by
         * another category. Blank values are ignored and reported as added.
         */
        public boolean tryAdd(FacetCategory category, String canonical, Collection<String> surfaces) {
            String value = normalizeCanonical(canonical);
            if (value.isEmpty()) return true;
            FacetCategory existing = owner.get(value);
            if (existing != null && existing != category) return false;
            owner.put(value, category);

            LinkedHashSet<String> forms = synonyms.get(category).computeIfAbsent(value, v -> new LinkedHashSet<>());
            List<String> all = new ArrayList<>();
            all.add(value);
            if (surfaces != null) all.addAll(surfaces);
            Map<String, String> lookup = surfaceToCanonical.get(category);
            for (String raw : all) {
                String surface = TextUtils.simplify(raw);
                if (surface.isEmpty()) continue;
                forms.add(surface);
                // First registration of a surface wins inside a category
                lookup.putIfAbsent(surface, value);
            }
            return true;
        }

        public Builder reference(FacetCategory category, String canonical, String phrase) {
            if (phrase != null && !phrase.isBlank()) {
                references.get(category).put(normalizeCanonical(canonical), phrase.trim());
            }
            return this;
        }

        public Builder fillerPhrase(String phrase) {
            String p = TextUtils.simplify(phrase);
            if (!p.isEmpty()) fillerPhrases.add(p);
            return this;
        }

        public Builder stopword(String word) {
            String w = TextUtils.simplify(word);
            if (!w.isEmpty()) stopwords.add(w);
            return this;
        }

        public Builder tagKeyword(FacetCategory category, String keyword) {
            if (keyword != null && !keyword.isBlank()) {
                tagKeywords.get(category).add(keyword.trim().toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public boolean owns(String canonical) {
            return owner.containsKey(normalizeCanonical(canonical));
        }

        public Lexicon build() {
            return new Lexicon(this);
        }

        private static String normalizeCanonical(String canonical) {
            return canonical == null ? "" : canonical.trim().toLowerCase(Locale.ROOT);
        }
    }
}
