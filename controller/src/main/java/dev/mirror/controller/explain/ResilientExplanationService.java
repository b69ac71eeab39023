package dev.mirror.controller.explain;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shields callers from a failing or silent {@link ExplanationService}: errors and empty answers
 * turn into a fixed sentence.
 */
public class ResilientExplanationService implements ExplanationService {

    static final String NO_EXPLANATION = "No explanation available.";
    static final String NO_SUMMARY = "Could not summarize repository.";

    private static final Logger LOGGER = LoggerFactory.getLogger(ResilientExplanationService.class);

    private final ExplanationService delegate;

    public ResilientExplanationService(ExplanationService delegate) {
        this.delegate = delegate;
    }

    @Override
    public String explain(String code, String fileName) {
        try {
            String text = delegate.explain(code, fileName);
            return text == null || text.isBlank() ? NO_EXPLANATION : text;
        } catch (RuntimeException e) {
            LOGGER.warn("Explanation of {} failed: {}", fileName, e.getMessage());
            return NO_EXPLANATION;
        }
    }

    @Override
    public String summarize(List<String> fileNames) {
        try {
            String text = delegate.summarize(fileNames);
            return text == null || text.isBlank() ? NO_SUMMARY : text;
        } catch (RuntimeException e) {
            LOGGER.warn("Summary of {} files failed: {}", fileNames.size(), e.getMessage());
            return NO_SUMMARY;
        }
    }
}
