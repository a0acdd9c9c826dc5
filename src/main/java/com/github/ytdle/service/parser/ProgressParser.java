package com.github.ytdle.service.parser;

import com.github.ytdle.model.ProgressUpdate;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for parsing progress information from fetch tool output.
 * One parser instance follows one attempt of one job.
 */
public interface ProgressParser {

    /**
     * Parse a single line of output and extract progress information.
     *
     * @param line Output line to parse
     * @param jobId Job ID for the progress update
     * @return ProgressUpdate if progress information was found, null otherwise
     */
    ProgressUpdate parseLine(String line, String jobId);

    /**
     * Reset the parser state (e.g., for a relaunch).
     */
    void reset();

    /**
     * Get the total size of the current file if known.
     *
     * @return Total size in bytes, or null if unknown
     */
    Long getTotalSize();

    /**
     * Final media file as last announced by the tool.
     *
     * @return path string, or null if nothing was announced
     */
    String getOutputPath();

    /**
     * Files announced since the previous call. Used to clean up partial artifacts.
     */
    List<Path> drainArtifacts();

    /**
     * Error lines printed by the tool, oldest first.
     */
    List<String> getErrorLines();
}
