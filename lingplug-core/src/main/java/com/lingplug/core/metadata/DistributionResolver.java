package com.lingplug.core.metadata;

import com.lingplug.api.plugin.PluginSpec;
import lombok.extern.slf4j.Slf4j;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.Optional;

/**
 * 查找插件来自哪个 classpath 条目
 */
@Slf4j
public class DistributionResolver {

    public Optional<Distribution> resolve(PluginSpec spec) {
        Class<?> type = spec.getFactory().getDeclaringType();
        if (type == null) {
            return Optional.empty();
        }
        CodeSource codeSource = type.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return Optional.empty();
        }
        URL location = codeSource.getLocation();
        try {
            Path path = Paths.get(location.toURI());
            return Optional.of(Distribution.at(path));
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Cannot map code source {} of {} to a path: {}", location, spec, e.getMessage());
            return Optional.empty();
        }
    }
}
