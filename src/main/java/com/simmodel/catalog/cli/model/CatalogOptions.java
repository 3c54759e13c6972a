package com.simmodel.catalog.cli.model;

import java.nio.file.Path;

import com.simmodel.catalog.catalog.config.CatalogConfig;

import lombok.Getter;
import lombok.Setter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options of the catalog command. No validation, no execution logic, no printing.
 */
@Getter
@Setter
public class CatalogOptions {

	@Option(names = { "--model-dir", "-d" }, required = true, description = "Model directory, scanned recursively for model stores")
	private String modelDir;

	@Option(names = { "--log-dir", "-l" }, description = "Model run log directory; model log is disabled if empty or missing")
	private String logDir;

	@Option(names = { "--root-dir" }, description = "Service root directory, reported in service state")
	private String rootDir;

	@Option(names = { "--extension" }, defaultValue = CatalogConfig.DEFAULT_STORE_EXTENSION, description = "Model store file extension (default: ${DEFAULT-VALUE})")
	private String storeExtension;

	@Option(names = { "--min-schema-version" }, defaultValue = "1", description = "Minimal supported model store schema version (default: ${DEFAULT-VALUE})")
	private int minSchemaVersion;

	@Option(names = { "--page-size" }, defaultValue = "100", description = "Default row page size reported in service state (default: ${DEFAULT-VALUE})")
	private long rowPageMaxSize;

	@Option(names = { "--find", "-f" }, description = "Model digest or name to look up after refresh")
	private String find;

	@Option(names = { "--lang" }, split = ",", description = "Preferred language tags for the model found by --find, comma-separated")
	private String[] languages;

	@Option(names = { "--report", "-r" }, description = "Write catalog report to this file")
	private Path reportFile;
}
