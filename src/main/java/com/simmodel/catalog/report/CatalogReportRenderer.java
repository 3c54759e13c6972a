package com.simmodel.catalog.report;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.admin.ServiceState;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a plain text report of the model catalog from the classpath template.
 */
public class CatalogReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(CatalogReportRenderer.class);

    static final String TEMPLATE_NAME = "catalog-report.ftl";

    private final Configuration freemarkerConfig;

    public CatalogReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @param state service state with model catalog snapshot
     * @param languages model language codes by model digest, default language first
     */
    public String render(ServiceState state, Map<String, List<String>> languages) throws IOException, TemplateException {
        Map<String, Object> model = new HashMap<>();
        model.put("state", state);
        model.put("catalog", state.getModelCatalogState());
        model.put("languages", languages != null ? languages : Map.of());

        Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
        StringWriter out = new StringWriter();
        template.process(model, out);
        return out.toString();
    }

    public void write(Path reportPath, ServiceState state, Map<String, List<String>> languages)
            throws IOException, TemplateException {
        String content = render(state, languages);

        Path parentDir = reportPath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(reportPath, content, StandardCharsets.UTF_8);
        log.info("Catalog report written: {}", reportPath.toAbsolutePath());
    }
}
