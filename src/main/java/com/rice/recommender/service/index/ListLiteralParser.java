package com.rice.recommender.service.index;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses list-like dataset cells such as {@code ['dinner', "mom's pie"]} (Python repr),
 * {@code ["a","b"]} (JSON) or plain {@code a, b} into a list of strings.
 */
public final class ListLiteralParser {
    private static final JsonMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};
    private static final Pattern QUOTED = Pattern.compile("'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\"");

    private ListLiteralParser() {}

    public static List<String> parse(String cell) {
        if (cell == null) return List.of();
        String s = cell.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("nan") || s.equals("[]")) return List.of();
        if (!s.startsWith("[")) {
            return splitPlain(s);
        }
        try {
            List<Object> values = LENIENT.readValue(s, LIST);
            List<String> out = new ArrayList<>(values.size());
            for (Object v : values) {
                if (v != null) out.add(String.valueOf(v));
            }
            return out;
        } catch (Exception e) {
            return extractQuoted(s);
        }
    }

    private static List<String> splitPlain(String s) {
        List<String> out = new ArrayList<>();
        for (String part : s.split("[,;|]")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Salvages the quoted items of a malformed literal. */
    private static List<String> extractQuoted(String s) {
        List<String> out = new ArrayList<>();
        Matcher m = QUOTED.matcher(s);
        while (m.find()) {
            String v = m.group(1) != null ? m.group(1) : m.group(2);
            out.add(v.replaceAll("\\\\(.)", "$1"));
        }
        return out;
    }
}
