package com.hcltech.textres.resources;

import com.hcltech.textres.common.IEnvGetter;
import com.hcltech.textres.common.errorsor.ErrorsOr;
import com.hcltech.textres.resources.config.TextResourcesConfig;
import com.hcltech.textres.resources.config.TextResourcesConfigLoader;
import com.hcltech.textres.resources.locate.ResourceGroupId;
import com.hcltech.textres.resources.source.ClasspathResourceSource;
import com.hcltech.textres.resources.source.ResourceSource;

/** Wiring for the common case: a JSON config on the classpath describing packaged resource files. */
public interface TextResources {

    String DEFAULT_CONFIG = "textresources.json";

    static ResourceSource classpathSource(TextResourcesConfig config) {
        return new ClasspathResourceSource(config.classpathRoot(), config.files());
    }

    /** Config from the classpath with environment overrides applied. */
    static ErrorsOr<TextResourcesConfig> loadConfig(String configPath, IEnvGetter env) {
        return TextResourcesConfigLoader.fromClasspath(configPath)
                .flatMap(c -> TextResourcesConfigLoader.withEnvOverrides(c, env));
    }

    /**
     * Builds a classpath-backed resolver for {@code groupId} and publishes it into {@code accessor}.
     *
     * @throws IllegalStateException if the configuration cannot be loaded
     */
    static ResourceResolver fromClasspath(String configPath, String groupId, ResourceAccessor accessor) {
        TextResourcesConfig config = loadConfig(configPath, IEnvGetter.env).valueOrThrow();
        return new ResourceResolver(ResourceGroupId.of(groupId), classpathSource(config), config, accessor);
    }

    static ResourceResolver fromClasspath(String groupId, ResourceAccessor accessor) {
        return fromClasspath(DEFAULT_CONFIG, groupId, accessor);
    }
}
