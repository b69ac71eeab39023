package dev.mirror.controller.explain;

import java.util.List;

/**
 * Boundary to the service that explains code to the user.
 */
public interface ExplanationService {

    /**
     * @param code source text to explain
     * @param fileName name of the file the text comes from
     */
    String explain(String code, String fileName);

    /**
     * @param fileNames paths of the repository's files
     */
    String summarize(List<String> fileNames);
}
