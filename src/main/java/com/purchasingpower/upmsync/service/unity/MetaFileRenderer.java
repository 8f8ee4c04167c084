package com.purchasingpower.upmsync.service.unity;

import com.purchasingpower.upmsync.model.unity.IdentityToken;
import com.purchasingpower.upmsync.model.unity.ImporterType;
import com.purchasingpower.upmsync.service.TemplateLibraryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders the text of a Unity .meta identity record.
 */
@Component
@RequiredArgsConstructor
public class MetaFileRenderer {

    static final String TEMPLATE = "meta-file";

    private final TemplateLibraryService templates;

    public String renderDirectory(IdentityToken token) {
        return render(token, ImporterType.DEFAULT, true);
    }

    public String renderFile(IdentityToken token, String fileName) {
        return render(token, ImporterType.forFileName(fileName), false);
    }

    private String render(IdentityToken token, ImporterType importer, boolean folder) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("guid", token.toGuid());
        variables.put("importer", importer.getUnityName());
        variables.put("folderAsset", folder);
        variables.put("monoScript", importer == ImporterType.MONO);
        return templates.render(TEMPLATE, variables);
    }
}
