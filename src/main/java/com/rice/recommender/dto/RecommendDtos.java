package com.rice.recommender.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rice.recommender.model.QueryIntent;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.List;

public class RecommendDtos {
    public static class RecommendRequestBody {
        @Size(max = 1000)
        private String q;
        @Min(1) @Max(20)
        private Integer topN; // null = configured default

        public String getQ() { return q; }
        public void setQ(String q) { this.q = q; }
        public Integer getTopN() { return topN; }
        public void setTopN(Integer topN) { this.topN = topN; }
    }

    public static class IntentRequestBody {
        @Size(max = 1000)
        private String q;

        public String getQ() { return q; }
        public void setQ(String q) { this.q = q; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class IntentResponseBody {
        private String query;
        private List<String> tokens;
        private QueryIntent intent;

        public IntentResponseBody() {}

        public IntentResponseBody(String query, List<String> tokens, QueryIntent intent) {
            this.query = query;
            this.tokens = tokens;
            this.intent = intent;
        }

        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public List<String> getTokens() { return tokens; }
        public void setTokens(List<String> tokens) { this.tokens = tokens; }
        public QueryIntent getIntent() { return intent; }
        public void setIntent(QueryIntent intent) { this.intent = intent; }
    }
}
