package com.dashboard.domain.catalog;

import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads SQL templates from the classpath and inspects their named parameters.
 */
final class SqlTemplates {

    private static final String LOCATION = "sql/";

    private SqlTemplates() {
    }

    static String load(AnalyticsOperation operation) {
        ClassPathResource resource = new ClassPathResource(LOCATION + operation.getOperationName() + ".sql");
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Missing SQL template for " + operation.getOperationName(), e);
        }
    }

    /**
     * Named parameters ({@code :name}) referenced by a template.
     * 
     * Skips PostgreSQL casts ({@code ::int}), quoted literals and comments,
     * following the same rules Spring's named parameter parser applies at execution time.
     */
    static Set<String> parameterNames(String sql) {
        Set<String> names = new LinkedHashSet<>();
        int length = sql.length();
        int i = 0;
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = sql.indexOf(c, i + 1);
                i = end < 0 ? length : end + 1;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end + 1;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else if (c == ':' && i + 1 < length && sql.charAt(i + 1) == ':') {
                i += 2;
            } else if (c == ':' && i + 1 < length && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
                int start = i + 1;
                int end = start;
                while (end < length && Character.isJavaIdentifierPart(sql.charAt(end))) {
                    end++;
                }
                names.add(sql.substring(start, end));
                i = end;
            } else {
                i++;
            }
        }
        return names;
    }
}
