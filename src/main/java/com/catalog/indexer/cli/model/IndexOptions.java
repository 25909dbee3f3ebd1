package com.catalog.indexer.cli.model;

import java.nio.file.Path;

import com.catalog.indexer.section.StopFencePolicy;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "index" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class IndexOptions {

	@Option(names = { "--text-dir", "-t" }, required = true, description = "Directory containing catalog_<YYYY>_<MM>.txt files")
	private Path textDir;

	@Option(names = { "--college-snapshots", "-s" }, required = true, description = "JSON file of valid college names per snapshot version")
	private Path collegeSnapshots;

	@Option(names = { "--college-order" }, description = "JSON file of canonical college ordering per version (defaults to --college-snapshots)")
	private Path collegeOrder;

	@Option(names = { "--degree-duplicates", "-d" }, required = true, description = "Degree duplicates JSON (flat map or list of raw_degree_name/resolved_name)")
	private Path degreeDuplicates;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to ./outputs)")
	private Path outputDir;

	@Option(names = {
			"--stop-fence" }, defaultValue = "SIBLING_OR_COLLEGE", description = "Section stop fence: SIBLING_OR_COLLEGE or SIBLING_ONLY")
	private StopFencePolicy stopFencePolicy;
}
