package com.simmodel.catalog;

import com.simmodel.catalog.cli.CatalogCommand;

import picocli.CommandLine;

/**
 * Main entry point of the model catalog tool.
 */
public class CatalogApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CatalogCommand()).execute(args);
        System.exit(exitCode);
    }
}
