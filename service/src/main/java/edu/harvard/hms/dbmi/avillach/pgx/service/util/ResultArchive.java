package edu.harvard.hms.dbmi.avillach.pgx.service.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.harvard.hms.dbmi.avillach.pgx.data.analysis.AnalysisResult;
import edu.harvard.hms.dbmi.avillach.pgx.processing.job.AnalysisJob;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes each finished job's result to {@code <jobId>.json} in {@code PGX_RESULTS_DIRECTORY}.
 * Disabled when the directory is not set. A failed write is logged and does not affect the job.
 * Archived results are read back on startup so finished jobs outlive a restart.
 */
@Component
public class ResultArchive {

    private static final Logger log = LoggerFactory.getLogger(ResultArchive.class);

    private final String resultsDirectory;

    private final ObjectMapper objectMapper;

    @Autowired
    public ResultArchive(@Value("${PGX_RESULTS_DIRECTORY:}") String resultsDirectory, ObjectMapper objectMapper) {
        this.resultsDirectory = resultsDirectory;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return resultsDirectory != null && !resultsDirectory.isBlank();
    }

    public void archive(AnalysisJob job) {
        if (!isEnabled()) {
            return;
        }
        AnalysisResult result = job.toResult();
        if (result == null) {
            return;
        }
        File target = new File(resultsDirectory, job.getId() + ".json");
        try {
            FileUtils.writeStringToFile(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result), StandardCharsets.UTF_8);
            log.info("Archived result of analysis " + job.getId() + " to " + target.getAbsolutePath());
        } catch (IOException e) {
            log.error("Unable to archive result of analysis " + job.getId(), e);
        }
    }

    /**
     * Reads every archived result. Files that cannot be read are logged and skipped.
     */
    public List<AnalysisResult> load() {
        List<AnalysisResult> results = new ArrayList<>();
        if (!isEnabled()) {
            return results;
        }
        File directory = new File(resultsDirectory);
        if (!directory.isDirectory()) {
            return results;
        }
        for (File file : FileUtils.listFiles(directory, new String[]{"json"}, false)) {
            try {
                AnalysisResult result = objectMapper.readValue(file, AnalysisResult.class);
                if (result.jobId() == null || result.state() == null || !result.state().isTerminal()) {
                    log.warn("Ignoring archived result " + file.getName() + " without a finished job");
                    continue;
                }
                results.add(result);
            } catch (IOException e) {
                log.error("Unable to read archived result " + file.getAbsolutePath(), e);
            }
        }
        log.info("Loaded " + results.size() + " archived results from " + directory.getAbsolutePath());
        return results;
    }

    /**
     * @return true when an archived file was removed
     */
    public boolean delete(String jobId) {
        if (!isEnabled()) {
            return false;
        }
        File target = new File(resultsDirectory, jobId + ".json");
        if (!target.exists()) {
            return false;
        }
        try {
            FileUtils.forceDelete(target);
            return true;
        } catch (IOException e) {
            log.error("Unable to delete archived result of analysis " + jobId, e);
            return false;
        }
    }
}
