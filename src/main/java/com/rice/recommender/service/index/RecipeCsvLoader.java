package com.rice.recommender.service.index;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.rice.recommender.model.Recipe;
import com.rice.recommender.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads the recipe dataset CSV.
 *
 * <p>Header names are matched case- and whitespace-insensitively. Required: {@code tags}
 * and {@code ingredients} (list-like cells, see {@link ListLiteralParser}). Optional:
 * {@code id} (defaults to the 1-based row number), {@code name} or {@code title},
 * {@code minutes}, {@code time_minutes} or {@code cook_minutes} (unparseable values read
 * as 0), and {@code description}. Unknown columns are ignored.
 */
public class RecipeCsvLoader {
    private static final Logger log = LoggerFactory.getLogger(RecipeCsvLoader.class);

    private static final List<String> ID_COLUMNS = List.of("id", "recipe_id");
    private static final List<String> TITLE_COLUMNS = List.of("name", "title");
    private static final List<String> TIME_COLUMNS = List.of("minutes", "time_minutes", "cook_minutes", "total_minutes");
    private static final List<String> DESCRIPTION_COLUMNS = List.of("description");

    private final CsvMapper csvMapper;

    public RecipeCsvLoader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public List<Recipe> load(InputStream in, String source) throws IOException {
        return load(new InputStreamReader(in, StandardCharsets.UTF_8), source);
    }

    public List<Recipe> load(Reader reader, String source) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Recipe> out = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            boolean any = it.hasNext();
            Map<String, String> columns = columnMap((CsvSchema) it.getParserSchema());
            if (!columns.containsKey("tags") || !columns.containsKey("ingredients")) {
                throw new DatasetFormatException("Dataset " + source + " must contain columns [tags, ingredients], found "
                        + columns.keySet());
            }
            if (!any) {
                log.warn("Dataset {} has no rows", source);
                return out;
            }
            int row = 0;
            while (it.hasNext()) {
                row++;
                Map<String, String> values = it.next();
                out.add(toRecipe(values, columns, row));
            }
        } catch (DatasetFormatException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DatasetFormatException("Failed to parse dataset " + source + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} recipes from {}", out.size(), source);
        return out;
    }

    /** Normalized column name to the header as written in the file. */
    private static Map<String, String> columnMap(CsvSchema schema) {
        Map<String, String> out = new LinkedHashMap<>();
        if (schema == null) return out;
        for (CsvSchema.Column column : schema) {
            String normalized = column.getName().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
            if (!normalized.equals(column.getName())) {
                log.debug("Normalizing dataset column '{}' to '{}'", column.getName(), normalized);
            }
            out.putIfAbsent(normalized, column.getName());
        }
        return out;
    }

    private static Recipe toRecipe(Map<String, String> values, Map<String, String> columns, int row) {
        String id = first(values, columns, ID_COLUMNS);
        if (id == null || id.isBlank()) id = String.valueOf(row);
        String title = first(values, columns, TITLE_COLUMNS);
        title = title == null || title.isBlank() ? "Recipe " + id : TextUtils.sanitizeTitle(title);
        String description = first(values, columns, DESCRIPTION_COLUMNS);
        if (description == null || description.equalsIgnoreCase("nan")) description = "";
        int minutes = parseMinutes(first(values, columns, TIME_COLUMNS));
        List<String> tags = ListLiteralParser.parse(values.get(columns.get("tags")));
        List<String> ingredients = ListLiteralParser.parse(values.get(columns.get("ingredients")));
        return new Recipe(id.trim(), title, description, tags, ingredients, minutes);
    }

    private static String first(Map<String, String> values, Map<String, String> columns, List<String> candidates) {
        for (String c : candidates) {
            String header = columns.get(c);
            if (header != null) return values.get(header);
        }
        return null;
    }

    static int parseMinutes(String raw) {
        if (raw == null || raw.isBlank()) return 0;
        try {
            double d = Double.parseDouble(raw.trim());
            if (Double.isNaN(d) || d < 0) return 0;
            return (int) Math.min(Integer.MAX_VALUE, d);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
