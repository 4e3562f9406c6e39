package com.pagesmith.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code pagesmith.yaml} into a {@link SiteConfig}.
 *
 * <p>A site always builds: a missing, unreadable or malformed file is reported in
 * the log and the build continues with {@link SiteConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // directories resolved against ~/blog, config read from ~/blog/pagesmith.yaml
 * SiteConfig config = ConfigLoader.loadSite(Paths.get("~/blog"), null);
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "pagesmith.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the configuration of a site rooted at {@code siteRoot}.
     *
     * <p>A relative {@code configFile} is looked up inside the site root. The
     * content, template and output directories of the result are resolved
     * against the site root as well, so the build does not depend on the
     * working directory.
     *
     * @param siteRoot site root directory
     * @param configFile configuration file, null for {@value #DEFAULT_FILE_NAME}
     * @return configuration with directories under {@code siteRoot}
     */
    public static SiteConfig loadSite(Path siteRoot, Path configFile) {
        Objects.requireNonNull(siteRoot, "siteRoot must not be null");
        Path file = configFile == null ? Path.of(DEFAULT_FILE_NAME) : configFile;
        Path resolved = file.isAbsolute() ? file : siteRoot.resolve(file);

        SiteConfig config = load(resolved).resolveAgainst(siteRoot);
        log.debug("Site {}: content={}, templates={}, output={}",
            siteRoot, config.contentDir(), config.templateDir(), config.outputDir());
        return config;
    }

    /**
     * Loads a configuration file as written, without resolving its directories.
     *
     * @param configPath path to the YAML file
     * @return parsed configuration, or defaults when the file cannot be used
     */
    public static SiteConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            log.warn("No site configuration at {}, building with default directories", configPath);
            return SiteConfig.defaults();
        }
        if (!Files.isReadable(configPath)) {
            log.warn("Site configuration {} is not readable, building with default directories", configPath);
            return SiteConfig.defaults();
        }

        try {
            SiteConfig config = YAML_MAPPER.readValue(configPath.toFile(), SiteConfig.class);
            if (config == null) {
                log.warn("Site configuration {} is empty, building with default directories", configPath);
                return SiteConfig.defaults();
            }
            log.info("Using site configuration {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Site configuration {} is not valid YAML, building with default directories: {}",
                configPath, e.getMessage());
            return SiteConfig.defaults();
        }
    }
}
