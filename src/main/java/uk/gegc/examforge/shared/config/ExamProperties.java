package uk.gegc.examforge.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Timeouts and presentation settings for the calls the paper lifecycle makes to its collaborators.
 */
@Data
@Component
@ConfigurationProperties(prefix = "exam")
public class ExamProperties {

    private Generation generation = new Generation();

    private Render render = new Render();

    private Insights insights = new Insights();

    @Data
    public static class Generation {
        /**
         * Upper bound on one generation or regeneration call, in seconds.
         * Default: 180
         */
        private int timeoutSeconds = 180;

        /**
         * Hard cap on questions in one paper.
         * Default: 200
         */
        private int maxQuestions = 200;
    }

    @Data
    public static class Render {
        /**
         * Upper bound on rendering one document, in seconds.
         * Default: 30
         */
        private int timeoutSeconds = 30;

        /**
         * Heading printed at the top of every paper.
         */
        private String institutionHeading = "UNIVERSITY EXAMINATION";
    }

    @Data
    public static class Insights {
        /**
         * Upper bound on one custom-analysis call, in seconds.
         * Default: 60
         */
        private int timeoutSeconds = 60;
    }
}
