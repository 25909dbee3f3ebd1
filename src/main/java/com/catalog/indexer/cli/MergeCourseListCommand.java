package com.catalog.indexer.cli;

import com.catalog.indexer.exception.CatalogIndexException;
import com.catalog.indexer.merge.CourseListMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Adds current college names to an external course list using courses_with_college.csv.
 */
@Command(
        name = "merge-course-list",
        mixinStandardHelpOptions = true,
        description = "Adds a Colleges column to a course list CSV, remapping historical college names."
)
public class MergeCourseListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MergeCourseListCommand.class);

    @Option(names = {"--colleges", "-c"}, required = true, description = "courses_with_college.csv produced by \"index\"")
    private Path coursesWithCollege;

    @Option(names = {"--course-list", "-l"}, required = true, description = "Course list CSV with a CourseCode column")
    private Path courseList;

    @Option(names = {"--output", "-o"}, required = true, description = "CSV file to write")
    private Path output;

    @Option(names = {"--remap", "-r"}, description = "JSON map of old to current college names (defaults to the bundled map)")
    private Path remap;

    @Override
    public Integer call() {
        for (Path p : new Path[] {coursesWithCollege, courseList}) {
            if (!Files.isRegularFile(p)) {
                log.error("Input CSV not found: {}", p);
                return 1;
            }
        }
        try {
            Map<String, String> collegeRemap = remap != null
                    ? CourseListMerger.loadRemap(remap)
                    : CourseListMerger.defaultRemap();
            new CourseListMerger(collegeRemap).merge(coursesWithCollege, courseList, output);
            return 0;
        } catch (CatalogIndexException | IOException e) {
            log.error("Merge failed: {}", e.getMessage());
            return 1;
        }
    }
}
