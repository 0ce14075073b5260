package webpilot.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webpilot.session.SessionConfig;

/**
 * Creates the appropriate VisionService based on config.
 */
public class VisionServiceFactory {
    private static final Logger log = LoggerFactory.getLogger(VisionServiceFactory.class);

    private VisionServiceFactory() {}

    public static VisionService create(SessionConfig config) {
        if (!config.isVisionEnabled()) {
            log.info("Vision disabled (vision.enabled=false), using StubVisionService");
            return new StubVisionService();
        }

        log.info("Vision enabled, creating OpenAiVisionClient for model {}", config.getVisionModel());
        return OpenAiVisionClient.fromConfig(config);
    }
}
