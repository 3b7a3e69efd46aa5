package com.e2eq.apiversion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and validates an {@link ApiConfig} from a YAML file or classpath resource.
 */
public final class ApiConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final ClassLoader classLoader;

    public ApiConfigLoader() {
        this(ApiConfigLoader.class.getClassLoader());
    }

    public ApiConfigLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public ApiConfig loadFromClasspath(String resourcePath) throws IOException {
        String name = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        try (InputStream in = classLoader.getResourceAsStream(name)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public ApiConfig loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public ApiConfig load(InputStream in) throws IOException {
        ApiConfig config = mapper.readValue(in, ApiConfig.class);
        ApiConfigValidator.validate(config);
        return config;
    }
}
