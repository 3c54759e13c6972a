package com.simmodel.catalog.cli;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.admin.CatalogAdminService;
import com.simmodel.catalog.catalog.CatalogException;
import com.simmodel.catalog.catalog.ModelCatalog;
import com.simmodel.catalog.catalog.RefreshResult;
import com.simmodel.catalog.catalog.config.CatalogConfig;
import com.simmodel.catalog.catalog.model.ModelBasic;
import com.simmodel.catalog.cli.exception.OptionsValidationException;
import com.simmodel.catalog.cli.model.CatalogOptions;
import com.simmodel.catalog.cli.model.ValidatedCatalogOptions;
import com.simmodel.catalog.cli.output.CatalogResultsPrinter;
import com.simmodel.catalog.cli.validation.CatalogOptionsValidator;
import com.simmodel.catalog.report.CatalogReportRenderer;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Scan the model directory, print the model catalog and optionally look up a model and write a report.
 */
@Command(
        name = "model-catalog",
        mixinStandardHelpOptions = true,
        version = "model-catalog 1.0.0",
        description = "Discovers model stores under a model directory and lists the models they contain."
)
public class CatalogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CatalogCommand.class);

    @Mixin
    CatalogOptions options = new CatalogOptions();

    private final CatalogOptionsValidator validator = new CatalogOptionsValidator();
    private final CatalogResultsPrinter printer = new CatalogResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCatalogOptions v;
        try {
            v = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        CatalogConfig config = CatalogConfig.builder()
                .modelDir(v.getModelDir())
                .modelLogDir(v.getLogDir())
                .storeExtension(v.getStoreExtension())
                .minSchemaVersion(options.getMinSchemaVersion())
                .rootDir(options.getRootDir())
                .rowPageMaxSize(options.getRowPageMaxSize())
                .build();

        printer.printBanner(v);

        ModelCatalog catalog = ModelCatalog.create(config);
        CatalogAdminService admin = new CatalogAdminService(config, catalog);
        try {
            RefreshResult result = catalog.refresh(config.getModelDir(), config.getModelLogDir());
            printer.printRefresh(result, catalog.allBasics());

            if (options.getFind() != null && !options.getFind().isBlank()) {
                lookup(catalog, options.getFind().trim(), v.getPreferredLanguages());
            }

            if (v.getReportPath() != null) {
                Map<String, List<String>> languages = new LinkedHashMap<>();
                for (String digest : catalog.allDigests()) {
                    catalog.languageCodes(digest).ifPresent(codes -> languages.put(digest, codes));
                }
                new CatalogReportRenderer().write(v.getReportPath(), admin.serviceState(), languages);
            }
            return 0;

        } catch (CatalogException e) {
            log.error("Failed to refresh models catalog: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Model catalog failed with exception", e);
            return 1;
        } finally {
            admin.closeAll();
        }
    }

    private void lookup(ModelCatalog catalog, String token, List<String> preferred) {
        Optional<ModelBasic> model = catalog.modelBasicByDigestOrName(token);
        if (model.isEmpty()) {
            printer.printNotFound(token);
            return;
        }
        // look up by digest from here on: name may be ambiguous
        String digest = model.get().getDigest();
        List<String> codes = catalog.languageCodes(digest).orElse(List.of());
        String matched = preferred.isEmpty() ? null : catalog.matchLanguage(digest, preferred).orElse(null);
        printer.printLookup(token, model.get(), codes, matched);
    }
}
