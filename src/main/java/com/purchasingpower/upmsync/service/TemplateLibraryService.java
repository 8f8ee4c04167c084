package com.purchasingpower.upmsync.service;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Template Library Service
 *
 * Loads Mustache templates from {@code classpath:templates/*.mustache} and renders
 * them with variables. The template name is the file name without extension.
 *
 * Usage:
 * String meta = templates.render("meta-file", Map.of(
 *     "guid", token.toGuid(),
 *     "importer", "MonoImporter"
 * ));
 */
@Slf4j
@Service
public class TemplateLibraryService {

    private static final String TEMPLATE_LOCATION = "classpath:templates/*.mustache";
    private static final String TEMPLATE_SUFFIX = ".mustache";

    // Output is Markdown and YAML, never HTML
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory() {
        @Override
        public void encode(String value, Writer writer) {
            try {
                writer.write(value);
            } catch (IOException e) {
                throw new MustacheException("Failed to write template value", e);
            }
        }
    };
    private final Map<String, Mustache> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadTemplates() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(TEMPLATE_LOCATION);

            for (Resource resource : resources) {
                String fileName = resource.getFilename();
                if (fileName == null || !fileName.endsWith(TEMPLATE_SUFFIX)) {
                    continue;
                }
                String name = fileName.substring(0, fileName.length() - TEMPLATE_SUFFIX.length());

                try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
                    templates.put(name, mustacheFactory.compile(reader, name));
                }
                log.debug("Loaded template: {}", name);
            }

            log.info("Loaded {} templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load templates", e);
            throw new IllegalStateException("Template library initialization failed", e);
        }
    }

    /**
     * Render a template with variables
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = templates.get(templateName);

        if (mustache == null) {
            throw new IllegalArgumentException("Template not found: " + templateName);
        }

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);

        return writer.toString();
    }
}
