package com.purchasingpower.upmsync.service.unity;

import com.purchasingpower.upmsync.model.spec.PackageSpec;
import com.purchasingpower.upmsync.model.sync.WorkspaceTree;
import com.purchasingpower.upmsync.model.unity.GeneratedFile;
import com.purchasingpower.upmsync.service.TemplateLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Generates README.md and LICENSE for a package.
 *
 * The README always opens with a not-affiliated disclaimer naming the upstream
 * organization, followed by the upstream README when the repository has one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PackageDocsGenerator {

    public static final String README_FILE = "README.md";
    public static final String LICENSE_FILE = "LICENSE";

    static final String TEMPLATE = "readme";
    static final String DEFAULT_UPSTREAM_AUTHOR = "the original package author";

    private static final Set<String> WELL_KNOWN_ORGANIZATIONS = Set.of(
            "microsoft", "google", "facebook", "meta", "apple", "oracle", "ibm", "amazon", "aws");

    private static final String GITHUB_HOST = "github.com";

    private final TemplateLibraryService templates;

    public List<GeneratedFile> generate(PackageSpec spec, WorkspaceTree workspace, String namespace) {
        List<GeneratedFile> files = new ArrayList<>();
        files.add(GeneratedFile.utf8(README_FILE, renderReadme(spec, workspace, namespace)));

        workspace.licenseFile().ifPresentOrElse(
                license -> files.add(new GeneratedFile(LICENSE_FILE, readBytes(license))),
                () -> log.info("{}: no license file in source repository", spec.getName()));

        return files;
    }

    String renderReadme(PackageSpec spec, WorkspaceTree workspace, String namespace) {
        String sourceUrl = spec.getSource().url();

        Map<String, Object> variables = new HashMap<>();
        variables.put("displayName", spec.effectiveDisplayName());
        variables.put("upstreamAuthor", upstreamAuthor(sourceUrl));
        variables.put("sourceUrl", sourceUrl);
        variables.put("packageName", spec.getName());
        variables.put("version", spec.effectiveVersion());
        variables.put("namespace", namespace);
        variables.put("commitId", workspace.resolvedRef().commitId());

        workspace.readmeFile().ifPresent(readme -> variables.put("originalReadme", decode(readBytes(readme))));
        variables.put("hasOriginalReadme", variables.containsKey("originalReadme"));

        return templates.render(TEMPLATE, variables);
    }

    /**
     * Name of whoever the package must not claim affiliation with, derived from a
     * GitHub URL; any other host falls back to a generic wording.
     */
    static String upstreamAuthor(String sourceUrl) {
        if (sourceUrl == null) {
            return DEFAULT_UPSTREAM_AUTHOR;
        }
        int host = sourceUrl.indexOf(GITHUB_HOST);
        if (host < 0) {
            return DEFAULT_UPSTREAM_AUTHOR;
        }

        String path = sourceUrl.substring(host + GITHUB_HOST.length());
        if (path.startsWith("/") || path.startsWith(":")) {
            path = path.substring(1);
        }
        String organization = path.split("/")[0].replace(".git", "");
        if (organization.isBlank()) {
            return DEFAULT_UPSTREAM_AUTHOR;
        }

        String lower = organization.toLowerCase(Locale.ROOT);
        if (WELL_KNOWN_ORGANIZATIONS.contains(lower)) {
            return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        }
        return "the " + organization + " organization";
    }

    private static byte[] readBytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
