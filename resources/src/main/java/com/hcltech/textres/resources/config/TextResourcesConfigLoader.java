package com.hcltech.textres.resources.config;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hcltech.textres.common.IEnvGetter;
import com.hcltech.textres.common.errorsor.ErrorsOr;
import com.hcltech.textres.resources.table.CollisionPolicy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public interface TextResourcesConfigLoader {

    String ENV_CULTURE_DELIMITER = "TEXTRES_CULTURE_DELIMITER";
    String ENV_COLLISION_POLICY = "TEXTRES_COLLISION_POLICY";
    String ENV_LINE_BREAK = "TEXTRES_LINE_BREAK";

    ObjectMapper JSON = JsonMapper.builder()
            // Open to extension: ignore extra fields in JSON
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            // Record constructor supplies defaults
            .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
            // Nice for human-authored JSON files
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
    ObjectReader CONFIG_READER = JSON.readerFor(TextResourcesConfig.class);

    // -------- Parse from JSON --------

    static ErrorsOr<TextResourcesConfig> fromJson(InputStream in) {
        try {
            TextResourcesConfig config = CONFIG_READER.readValue(in);
            return validated(config);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to parse TextResourcesConfig: {0}: {1}", e);
        }
    }

    static ErrorsOr<TextResourcesConfig> fromJson(String json) {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read TextResourcesConfig JSON: {0}: {1}", e);
        }
    }

    // -------- Load from classpath --------

    static ErrorsOr<TextResourcesConfig> fromClasspath(String resourcePath) {
        return fromClasspath(resourcePath, Thread.currentThread().getContextClassLoader());
    }

    static ErrorsOr<TextResourcesConfig> fromClasspath(String resourcePath, ClassLoader cl) {
        try {
            InputStream in = (cl == null) ? null : cl.getResourceAsStream(resourcePath);
            if (in == null) {
                ClassLoader fallback = TextResourcesConfigLoader.class.getClassLoader();
                in = (fallback == null) ? null : fallback.getResourceAsStream(resourcePath);
            }
            if (in == null) {
                return ErrorsOr.error("Classpath resource not found: " + resourcePath);
            }
            try (InputStream autoClose = in) {
                return fromJson(autoClose).addPrefixIfError("text resources config '" + resourcePath + "': ");
            }
        } catch (Exception e) {
            return ErrorsOr.error("Failed to load TextResourcesConfig from classpath '" + resourcePath + "': "
                    + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // -------- Environment overrides --------

    /** Environment variables win over file values; unset or blank variables leave the file value alone. */
    static ErrorsOr<TextResourcesConfig> withEnvOverrides(TextResourcesConfig config, IEnvGetter env) {
        return ErrorsOr.trying(() -> config
                        .withCultureDelimiter(IEnvGetter.getStringOr(env, ENV_CULTURE_DELIMITER, config.cultureDelimiter()))
                        .withCollisionPolicy(IEnvGetter.getEnumOr(env, ENV_COLLISION_POLICY, CollisionPolicy.class, config.collisionPolicy()))
                        .withLineBreak(IEnvGetter.getStringOr(env, ENV_LINE_BREAK, config.lineBreak())))
                .flatMap(TextResourcesConfigLoader::validated);
    }

    // -------- Validation: return list of error strings (empty = OK) --------

    private static ErrorsOr<TextResourcesConfig> validated(TextResourcesConfig config) {
        List<String> errs = validate(config);
        return errs.isEmpty() ? ErrorsOr.lift(config) : ErrorsOr.errors(errs);
    }

    private static List<String> validate(TextResourcesConfig config) {
        List<String> errs = new ArrayList<>();
        if (config == null) {
            errs.add("TextResourcesConfig is null");
            return errs;
        }
        if (config.cultureDelimiter().isEmpty()) {
            errs.add("TextResourcesConfig.cultureDelimiter must be non-empty");
        }
        if (config.lineBreak().isEmpty()) {
            errs.add("TextResourcesConfig.lineBreak must be non-empty");
        }
        List<String> files = config.files();
        for (int i = 0; i < files.size(); i++) {
            String f = files.get(i);
            if (f == null || f.isBlank()) {
                errs.add("TextResourcesConfig.files[" + i + "] must be non-empty");
            }
        }
        return errs;
    }
}
