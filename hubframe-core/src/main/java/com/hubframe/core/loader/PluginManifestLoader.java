package com.hubframe.core.loader;

import com.hubframe.api.exception.HubException;
import com.hubframe.api.model.RuntimeMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class PluginManifestLoader {

    public static final String MANIFEST_FILE = "plugin.yml";

    public static PluginManifest load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(PluginManifest.class, options);
        Yaml yaml = new Yaml(constructor);

        PluginManifest manifest;
        try {
            manifest = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new HubException("Malformed plugin manifest: " + e.getMessage(), e);
        }
        validate(manifest);
        return manifest;
    }

    /**
     * 读取目录下的 plugin.yml，或直接读取给定的清单文件
     */
    public static PluginManifest load(Path path) {
        Path manifestFile = Files.isDirectory(path) ? path.resolve(MANIFEST_FILE) : path;
        if (!Files.isRegularFile(manifestFile)) {
            throw new HubException("Plugin manifest not found: " + manifestFile);
        }
        try (InputStream in = Files.newInputStream(manifestFile)) {
            return load(in);
        } catch (IOException e) {
            throw new HubException("Failed to read plugin manifest " + manifestFile, e);
        }
    }

    private static void validate(PluginManifest manifest) {
        if (manifest == null) {
            throw new HubException("Plugin manifest is empty");
        }
        if (manifest.getId() == null || manifest.getId().isBlank()) {
            throw new HubException("Plugin manifest is missing 'id'");
        }
        try {
            List<RuntimeMode> supported = manifest.resolveSupportedModes();
            RuntimeMode mode = manifest.resolveRuntimeMode();
            if (mode != null && !supported.isEmpty() && !supported.contains(mode)) {
                throw new HubException("Manifest of [" + manifest.getId() + "] declares runtimeMode "
                        + mode + " outside supportedModes " + supported);
            }
            manifest.resolveConfigSchema();
            manifest.resolveDependencies();
        } catch (IllegalArgumentException e) {
            throw new HubException("Invalid manifest of [" + manifest.getId() + "]: " + e.getMessage(), e);
        }
    }
}
