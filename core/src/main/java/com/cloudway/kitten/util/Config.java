/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;

/**
 * Configuration properties loaded from a classpath resource. A system
 * property with the same name overrides the value in the resource.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    /**
     * The name of the default configuration resource.
     */
    public static final String DEFAULT_RESOURCE = "kitten.properties";

    private static final Supplier<Config> default_config =
        Suppliers.memoize(() -> load(DEFAULT_RESOURCE));

    private final Properties conf;

    public Config(Properties conf) {
        this.conf = requireNonNull(conf);
    }

    /**
     * Returns the configuration loaded from {@value #DEFAULT_RESOURCE}.
     * The resource is read once.
     */
    public static Config getDefault() {
        return default_config.get();
    }

    /**
     * Load configuration from the given classpath resource. A missing
     * resource yields an empty configuration.
     *
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static Config load(String resource) {
        Properties props = new Properties();
        ClassLoader loader = Config.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(requireNonNull(resource))) {
            if (in != null) {
                props.load(in);
            } else {
                logger.fine(() -> "Configuration resource " + resource + " not found, using defaults");
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read configuration " + resource, ex);
        }
        return new Config(props);
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.getProperty(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(String::trim).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(String::trim).map(Integer::parseInt).orElse(deflt);
    }

    public String toString() {
        return conf.toString();
    }
}
