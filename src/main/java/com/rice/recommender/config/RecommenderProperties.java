package com.rice.recommender.config;

import com.rice.recommender.service.ranking.MatchMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Recommendation tuning and data locations.
 *
 * Properties are prefixed with "recommender" in application.yml.
 */
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {
    /** Default number of recipes returned per query */
    private int topN = 3;
    /** Minimum cosine similarity (exclusive) for a semantic facet match */
    private double semanticThreshold = 0.55;
    /** Ceiling applied for "quick" style requests (minutes) */
    private int quickCeilingMinutes = 30;
    /** Floor applied for "slow" style requests (minutes) */
    private int slowFloorMinutes = 60;
    /** ALL: every requested facet must match. ANY: at least one */
    private MatchMode matchMode = MatchMode.ALL;
    /** Spring resource location of the recipe CSV */
    private String datasetPath = "classpath:data/recipes.csv";
    /** Spring resource location of the lexicon JSON */
    private String lexiconPath = "classpath:lexicon.json";
    /** Embed recipe descriptions at startup for similarity ordering */
    private boolean embedDescriptions = true;
    /** Add dataset tags and ingredients to the lexicon at startup */
    private boolean augmentLexicon = true;
    private Console console = new Console();

    public int getTopN() { return topN; }
    public void setTopN(int topN) { this.topN = topN; }

    public double getSemanticThreshold() { return semanticThreshold; }
    public void setSemanticThreshold(double semanticThreshold) { this.semanticThreshold = semanticThreshold; }

    public int getQuickCeilingMinutes() { return quickCeilingMinutes; }
    public void setQuickCeilingMinutes(int quickCeilingMinutes) { this.quickCeilingMinutes = quickCeilingMinutes; }

    public int getSlowFloorMinutes() { return slowFloorMinutes; }
    public void setSlowFloorMinutes(int slowFloorMinutes) { this.slowFloorMinutes = slowFloorMinutes; }

    public MatchMode getMatchMode() { return matchMode; }
    public void setMatchMode(MatchMode matchMode) { this.matchMode = matchMode; }

    public String getDatasetPath() { return datasetPath; }
    public void setDatasetPath(String datasetPath) { this.datasetPath = datasetPath; }

    public String getLexiconPath() { return lexiconPath; }
    public void setLexiconPath(String lexiconPath) { this.lexiconPath = lexiconPath; }

    public boolean isEmbedDescriptions() { return embedDescriptions; }
    public void setEmbedDescriptions(boolean embedDescriptions) { this.embedDescriptions = embedDescriptions; }

    public boolean isAugmentLexicon() { return augmentLexicon; }
    public void setAugmentLexicon(boolean augmentLexicon) { this.augmentLexicon = augmentLexicon; }

    public Console getConsole() { return console; }
    public void setConsole(Console console) { this.console = console; }

    public static class Console {
        /** Start the interactive stdin chat loop after startup */
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
