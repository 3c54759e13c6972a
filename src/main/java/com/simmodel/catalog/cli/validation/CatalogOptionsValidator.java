package com.simmodel.catalog.cli.validation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.simmodel.catalog.cli.exception.OptionsValidationException;
import com.simmodel.catalog.cli.model.CatalogOptions;
import com.simmodel.catalog.cli.model.ValidatedCatalogOptions;

/**
 * Checks option shape only. Model directory existence is checked by the catalog refresh.
 */
public class CatalogOptionsValidator {

	public ValidatedCatalogOptions validate(CatalogOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getModelDir())) {
			errors.add("Model directory is required (--model-dir / -d).");
		}

		String ext = o.getStoreExtension();
		if (isBlank(ext) || ext.trim().equals(".")) {
			errors.add("Model store extension cannot be empty (--extension).");
		} else if (ext.contains("/") || ext.contains("\\")) {
			errors.add("Model store extension must not contain path separators. Got: " + ext);
		}

		if (o.getMinSchemaVersion() < 0) {
			errors.add("Minimal schema version must be >= 0. Got: " + o.getMinSchemaVersion());
		}
		if (o.getRowPageMaxSize() <= 0) {
			errors.add("Row page size must be > 0. Got: " + o.getRowPageMaxSize());
		}

		List<String> langs = parseLanguages(o.getLanguages());
		if (!langs.isEmpty() && isBlank(o.getFind())) {
			errors.add("Preferred languages (--lang) require a model to look up (--find).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String normalizedExt = ext.trim().startsWith(".") ? ext.trim() : "." + ext.trim();
		String logDir = o.getLogDir() == null ? "" : o.getLogDir().trim();
		Path reportPath = o.getReportFile() == null ? null : o.getReportFile().toAbsolutePath().normalize();

		return new ValidatedCatalogOptions(o.getModelDir().trim(), logDir, normalizedExt, langs, reportPath);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> parseLanguages(String[] raw) {
		if (raw == null) {
			return List.of();
		}
		return Arrays.stream(raw).map(String::trim).filter(s -> !s.isEmpty()).toList();
	}
}
