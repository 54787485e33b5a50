package com.rice.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RecipeRecommenderApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecipeRecommenderApplication.class, args);
    }
}
