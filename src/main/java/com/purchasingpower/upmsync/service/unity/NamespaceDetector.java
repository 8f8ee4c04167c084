package com.purchasingpower.upmsync.service.unity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the first declared C# namespace in a source tree.
 *
 * Files are visited in sorted path order so the result does not depend on
 * filesystem iteration order.
 */
@Slf4j
@Component
public class NamespaceDetector {

    private static final Pattern NAMESPACE_DECLARATION = Pattern.compile(
            "^\\s*namespace\\s+([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)",
            Pattern.MULTILINE);

    public Optional<String> detect(Path sourceRoot) {
        if (!Files.isDirectory(sourceRoot)) {
            return Optional.empty();
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(sourceRoot)) {
            sources = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".cs"))
                    .filter(p -> !ProjectFileFilter.isProjectFile(sourceRoot.relativize(p).toString().replace('\\', '/')))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + sourceRoot + " for namespaces", e);
        }

        for (Path source : sources) {
            Optional<String> namespace = firstNamespace(source);
            if (namespace.isPresent()) {
                log.debug("Discovered namespace '{}' in {}", namespace.get(), sourceRoot.relativize(source));
                return namespace;
            }
        }

        return Optional.empty();
    }

    Optional<String> firstNamespace(Path source) {
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.debug("Skipping non UTF-8 source {}", source);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }

        Matcher matcher = NAMESPACE_DECLARATION.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
