package com.catalog.indexer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.catalog.indexer.cli.exception.OptionsValidationException;
import com.catalog.indexer.cli.model.IndexOptions;
import com.catalog.indexer.cli.model.ValidatedIndexOptions;
import com.catalog.indexer.config.ConfigPaths;

public class IndexOptionsValidator {

	static final Path DEFAULT_OUTPUT_DIR = Path.of("outputs");

	public ValidatedIndexOptions validate(IndexOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getTextDir() == null) {
			errors.add("Text directory is required (--text-dir / -t).");
		} else if (!existsDirectory(o.getTextDir())) {
			errors.add("Text directory does not exist or is not a directory: " + o.getTextDir());
		}

		requireFile(o.getCollegeSnapshots(), "College snapshots file (--college-snapshots / -s)", errors);
		requireFile(o.getDegreeDuplicates(), "Degree duplicates file (--degree-duplicates / -d)", errors);

		if (o.getCollegeOrder() != null && !Files.isRegularFile(o.getCollegeOrder())) {
			errors.add("College order file does not exist: " + o.getCollegeOrder());
		}

		if (o.getStopFencePolicy() == null) {
			errors.add("Stop fence policy is required (--stop-fence).");
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? DEFAULT_OUTPUT_DIR : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ConfigPaths paths = ConfigPaths.builder()
				.textDir(o.getTextDir())
				.collegeSnapshots(o.getCollegeSnapshots())
				.collegeOrder(o.getCollegeOrder())
				.degreeDuplicates(o.getDegreeDuplicates())
				.outputDir(normalizedOutputDir)
				.stopFencePolicy(o.getStopFencePolicy())
				.build();

		return new ValidatedIndexOptions(normalizedOutputDir, paths);
	}

	private static void requireFile(Path p, String label, List<String> errors) {
		if (p == null) {
			errors.add(label + " is required.");
		} else if (!Files.isRegularFile(p)) {
			errors.add(label + " does not exist: " + p);
		}
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
