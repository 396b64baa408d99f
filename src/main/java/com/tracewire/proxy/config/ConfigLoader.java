package com.tracewire.proxy.config;

import com.tracewire.proxy.core.exceptions.ConfigException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link TracewireProperties} from a YAML file on disk or, failing that,
 * from the classpath.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads the configuration from the specified path or classpath resource.
     * 
     * @param path Path to the configuration file.
     * @return Loaded properties.
     * @throws ConfigException if the configuration cannot be found or parsed.
     */
    public static TracewireProperties load(String path) {
        Yaml yaml = new Yaml(new Constructor(TracewireProperties.class, new LoaderOptions()));

        TracewireProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        TracewireProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static TracewireProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orEmpty(yaml.load(is));
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private static TracewireProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orEmpty(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    // An empty document loads as null
    private static TracewireProperties orEmpty(TracewireProperties loaded) {
        return loaded != null ? loaded : new TracewireProperties();
    }
}
