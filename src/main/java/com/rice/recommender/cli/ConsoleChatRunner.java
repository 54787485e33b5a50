package com.rice.recommender.cli;

import com.rice.recommender.service.RecipeFormatter;
import com.rice.recommender.service.RecommendationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Interactive stdin loop: one request per line, formatted recommendations back.
 * {@code quit} or {@code exit} (or end of input) ends the loop.
 */
@Component
@ConditionalOnProperty(prefix = "recommender.console", name = "enabled", havingValue = "true")
public class ConsoleChatRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ConsoleChatRunner.class);
    private static final Set<String> EXIT_WORDS = Set.of("quit", "exit");
    static final String PROMPT = "You: ";
    static final String SPEAKER = "Recipe Recommender: ";

    private final RecommendationService recommendationService;
    private final RecipeFormatter formatter;

    public ConsoleChatRunner(RecommendationService recommendationService, RecipeFormatter formatter) {
        this.recommendationService = recommendationService;
        this.formatter = formatter;
    }

    @Override
    public void run(String... args) throws IOException {
        chat(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    }

    /** Runs the loop until an exit word or end of input. */
    public void chat(Reader input, PrintStream out) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        out.println("RECIPE RECOMMENDER\nType 'quit' to exit.");
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null || EXIT_WORDS.contains(line.trim().toLowerCase(Locale.ROOT))) {
                out.println(SPEAKER + "Goodbye!");
                return;
            }
            if (line.isBlank()) continue;
            try {
                out.println(SPEAKER + formatter.format(recommendationService.recommend(line)));
            } catch (RuntimeException e) {
                log.error("Failed to answer '{}'", line, e);
                out.println("Error: " + e.getMessage() + ". Please try again.");
            }
        }
    }
}
